package probe.protocol;

import model.Protocol;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Thread-safe registry mapping each {@link Protocol} to the factory that creates its clients.
 * Factories are usually registered by {@link ProtocolPluginLoader}.
 *
 * <p><b>Usage Example:</b>
 * <pre>
 * ProtocolRegistry registry = ProtocolRegistry.getInstance();
 * new ProtocolPluginLoader("plugins").discoverClientFactories(registry);
 *
 * Supplier&lt;FtpClient&gt; ftpClients = registry.clientSupplier(Protocol.FTP, FtpClient.class);
 * try (FtpClient client = ftpClients.get()) {
 *     client.connect("ftp.example.com", 21, 10_000);
 * }
 * </pre>
 */
public class ProtocolRegistry {

    private static final Logger logger = Logger.getLogger(ProtocolRegistry.class.getName());
    private static final ProtocolRegistry INSTANCE = new ProtocolRegistry();

    private final Map<Protocol, ProtocolClientFactory<?>> factories;

    public ProtocolRegistry() {
        this.factories = new ConcurrentHashMap<>();
    }

    /**
     * Get the process-wide registry.
     */
    public static ProtocolRegistry getInstance() {
        return INSTANCE;
    }

    /**
     * Register a client factory. A factory already registered for the same protocol is replaced.
     *
     * @param factory the factory to register
     * @throws IllegalArgumentException if factory or its protocol is null
     */
    public void register(ProtocolClientFactory<?> factory) {
        if (factory == null) {
            throw new IllegalArgumentException("Protocol client factory cannot be null");
        }
        Protocol protocol = factory.getProtocol();
        if (protocol == null) {
            throw new IllegalArgumentException("Protocol of " + factory.getClass().getName() + " cannot be null");
        }

        ProtocolClientFactory<?> previous = factories.put(protocol, factory);
        if (previous != null && previous.getClass() != factory.getClass()) {
            logger.warning(String.format(
                    "Client factory for %s already registered, replacing %s with %s",
                    protocol, previous.getClass().getName(), factory.getClass().getName()));
        }

        logger.fine(String.format("Registered client factory: %s (%s)", protocol, factory.getDescription()));
    }

    /**
     * @return true if a factory was removed
     */
    public boolean unregister(Protocol protocol) {
        return protocol != null && factories.remove(protocol) != null;
    }

    public Optional<ProtocolClientFactory<?>> getFactory(Protocol protocol) {
        return Optional.ofNullable(protocol != null ? factories.get(protocol) : null);
    }

    public boolean hasFactory(Protocol protocol) {
        return protocol != null && factories.containsKey(protocol);
    }

    /**
     * Get a supplier of fresh clients of the given surface for a protocol.
     *
     * @param protocol the protocol
     * @param clientType expected client surface, e.g. {@code FtpClient.class}
     * @return supplier creating one client per call
     * @throws IllegalStateException if no factory is registered for the protocol
     */
    public <C extends ProtocolClient> Supplier<C> clientSupplier(Protocol protocol, Class<C> clientType) {
        ProtocolClientFactory<?> factory = getFactory(protocol)
                .orElseThrow(() -> new IllegalStateException("No client registered for protocol " + protocol));
        return () -> clientType.cast(factory.createClient());
    }

    public Set<Protocol> getRegisteredProtocols() {
        EnumSet<Protocol> protocols = EnumSet.noneOf(Protocol.class);
        protocols.addAll(factories.keySet());
        return Collections.unmodifiableSet(protocols);
    }

    /**
     * Useful for testing or reinitialization.
     */
    public void clear() {
        factories.clear();
    }

    @Override
    public String toString() {
        return String.format("ProtocolRegistry{protocols=%s}", factories.keySet());
    }
}
