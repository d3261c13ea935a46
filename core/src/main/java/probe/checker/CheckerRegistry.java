package probe.checker;

import model.Protocol;
import probe.protocol.FtpClient;
import probe.protocol.ProtocolRegistry;
import probe.protocol.SftpClient;

import java.util.*;

/**
 * Dispatch table from protocol tag to its checker.
 */
public class CheckerRegistry {

    private final Map<Protocol, ProtocolChecker> checkers = new EnumMap<>(Protocol.class);

    public CheckerRegistry(Collection<? extends ProtocolChecker> checkers) {
        for (ProtocolChecker checker : checkers) {
            this.checkers.put(checker.getProtocol(), checker);
        }
    }

    /**
     * Build checkers for every protocol whose client is registered.
     *
     * @param registry registry filled by the plugin loader
     * @return registry of checkers, possibly empty
     */
    public static CheckerRegistry fromProtocolRegistry(ProtocolRegistry registry) {
        List<ProtocolChecker> checkers = new ArrayList<>();
        if (registry.hasFactory(Protocol.FTP)) {
            checkers.add(new FtpChecker(registry.clientSupplier(Protocol.FTP, FtpClient.class)));
        }
        if (registry.hasFactory(Protocol.SFTP)) {
            checkers.add(new SftpChecker(registry.clientSupplier(Protocol.SFTP, SftpClient.class)));
        }
        return new CheckerRegistry(checkers);
    }

    /**
     * @throws IllegalStateException if no checker handles the protocol
     */
    public ProtocolChecker getChecker(Protocol protocol) {
        ProtocolChecker checker = checkers.get(protocol);
        if (checker == null) {
            throw new IllegalStateException("No checker available for protocol " + protocol);
        }
        return checker;
    }

    public boolean supports(Protocol protocol) {
        return checkers.containsKey(protocol);
    }

    public Set<Protocol> getSupportedProtocols() {
        return Collections.unmodifiableSet(checkers.keySet());
    }
}
