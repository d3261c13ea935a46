package probe.checker;

import model.ErrorKind;
import model.PathType;
import model.ProbeDescriptor;
import model.ProbeResult;
import model.Protocol;
import probe.protocol.ProtocolException;
import probe.protocol.RemoteFileAttributes;
import probe.protocol.SftpClient;

import java.util.function.Supplier;

/**
 * SFTP checker: merged SSH handshake and authentication, then optional stat of a path.
 *
 * <p>The SSH transport authenticates as part of connecting, so a single measurement is taken
 * and recorded as both {@code connectionTimeMs} and {@code authTimeMs}. These two values are
 * therefore not comparable with the separate FTP timings. For the same reason a rejected
 * password leaves {@code connection=false}: the combined handshake did not complete.
 *
 * <p>No banner and no feature list are collected.
 */
public class SftpChecker extends AbstractProtocolChecker<SftpClient> {

    public SftpChecker(Supplier<? extends SftpClient> clientSupplier) {
        super(clientSupplier);
    }

    @Override
    public Protocol getProtocol() {
        return Protocol.SFTP;
    }

    @Override
    protected void performChecks(SftpClient client, ProbeDescriptor descriptor, int timeoutMs,
                                 ProbeResult.Builder result) {
        long start = System.nanoTime();
        try {
            client.connect(descriptor.endpoint().host(), descriptor.endpoint().port(),
                    descriptor.credential().username(), descriptor.credential().password(), timeoutMs);
            double elapsed = StageTimer.millisSince(start);
            result.connection(true).connectionTimeMs(elapsed)
                    .authentication(true).authTimeMs(elapsed);
        } catch (ProtocolException e) {
            logger.fine("SFTP handshake failed for " + descriptor + ": " + e);
            switch (e.getErrorType()) {
                case AUTHENTICATION_FAILED ->
                        result.addError(ErrorKind.AUTHENTICATION_FAILURE, "Authentication failed");
                case CONNECTION_TIMEOUT -> result.addError(ErrorKind.CONNECTION_TIMEOUT, "Connection timed out");
                case HOST_RESOLUTION_FAILED ->
                        result.addError(ErrorKind.HOSTNAME_RESOLUTION_FAILURE, "Hostname resolution failed");
                default -> result.addError(ErrorKind.CONNECTION_REFUSED_OR_PROTOCOL_ERROR,
                        "SSH error: " + describe(e));
            }
            return;
        }

        if (descriptor.hasCheckPath()) {
            try (StageTimer ignored = StageTimer.start(result::pathCheckTimeMs)) {
                checkPath(client, descriptor.checkPath(), result);
            }
        }
    }

    private void checkPath(SftpClient client, String path, ProbeResult.Builder result) {
        try {
            RemoteFileAttributes attributes = client.stat(path);
            result.pathExists(true);
            if (attributes.hasPermissions()) {
                result.pathType(attributes.isDirectory() ? PathType.DIRECTORY : PathType.FILE);
            }
        } catch (ProtocolException e) {
            result.pathExists(false);
            if (e.getErrorType() == ProtocolException.ErrorType.NOT_FOUND) {
                result.addError(ErrorKind.PATH_CHECK_ERROR, "Path '" + path + "' not found");
            } else {
                result.addError(ErrorKind.PATH_CHECK_ERROR, "Path check error: " + describe(e));
            }
        } catch (RuntimeException e) {
            result.pathExists(false).addError(ErrorKind.PATH_CHECK_ERROR, "Path check error: " + describe(e));
        }
    }
}
