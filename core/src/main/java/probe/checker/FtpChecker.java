package probe.checker;

import model.ErrorKind;
import model.PathType;
import model.ProbeDescriptor;
import model.ProbeResult;
import model.Protocol;
import probe.protocol.FtpClient;
import probe.protocol.ProtocolException;

import java.util.List;
import java.util.function.Supplier;

/**
 * FTP checker: connect, read banner, login, FEAT, optional path check.
 *
 * <p>Path check: CWD into the path first; success means a directory. If CWD is refused,
 * the parent directory is listed and the last path segment is looked up by exact name.
 * Failures while accessing the parent are reported coarsely, without telling a missing
 * parent from a forbidden one.
 */
public class FtpChecker extends AbstractProtocolChecker<FtpClient> {

    public FtpChecker(Supplier<? extends FtpClient> clientSupplier) {
        super(clientSupplier);
    }

    @Override
    public Protocol getProtocol() {
        return Protocol.FTP;
    }

    @Override
    protected void performChecks(FtpClient client, ProbeDescriptor descriptor, int timeoutMs,
                                 ProbeResult.Builder result) {
        if (!connect(client, descriptor, timeoutMs, result)) {
            return;
        }

        result.welcomeMessage(client.getWelcomeMessage());

        if (!login(client, descriptor, result)) {
            return;
        }

        discoverFeatures(client, result);

        if (descriptor.hasCheckPath()) {
            try (StageTimer ignored = StageTimer.start(result::pathCheckTimeMs)) {
                checkPath(client, descriptor.checkPath(), result);
            }
        }
    }

    private boolean connect(FtpClient client, ProbeDescriptor descriptor, int timeoutMs,
                            ProbeResult.Builder result) {
        long start = System.nanoTime();
        try {
            client.connect(descriptor.endpoint().host(), descriptor.endpoint().port(), timeoutMs);
            result.connection(true).connectionTimeMs(StageTimer.millisSince(start));
            return true;
        } catch (ProtocolException e) {
            logger.fine("FTP connect failed for " + descriptor + ": " + e);
            switch (e.getErrorType()) {
                case CONNECTION_TIMEOUT -> result.addError(ErrorKind.CONNECTION_TIMEOUT, "Connection timed out");
                case HOST_RESOLUTION_FAILED ->
                        result.addError(ErrorKind.HOSTNAME_RESOLUTION_FAILURE, "Hostname resolution failed");
                default -> result.addError(ErrorKind.CONNECTION_REFUSED_OR_PROTOCOL_ERROR,
                        "FTP error: " + describe(e));
            }
            return false;
        }
    }

    private boolean login(FtpClient client, ProbeDescriptor descriptor, ProbeResult.Builder result) {
        long start = System.nanoTime();
        try {
            client.login(descriptor.credential().username(), descriptor.credential().password());
            result.authentication(true).authTimeMs(StageTimer.millisSince(start));
            return true;
        } catch (ProtocolException e) {
            logger.fine("FTP login failed for " + descriptor + ": " + e);
            ErrorKind kind = switch (e.getErrorType()) {
                case AUTHENTICATION_FAILED -> ErrorKind.AUTHENTICATION_FAILURE;
                case CONNECTION_TIMEOUT -> ErrorKind.CONNECTION_TIMEOUT;
                default -> ErrorKind.TRANSPORT_PROTOCOL_ERROR;
            };
            result.addError(kind, "FTP error: " + describe(e));
            return false;
        }
    }

    private void discoverFeatures(FtpClient client, ProbeResult.Builder result) {
        try {
            result.features(client.listFeatures());
        } catch (ProtocolException e) {
            switch (e.getErrorType()) {
                // FEAT не поддерживается или запрещен - это не ошибка проверки
                case NOT_SUPPORTED, PERMISSION_DENIED -> logger.finer("FEAT unavailable: " + e.getMessage());
                default -> result.addError(ErrorKind.TRANSPORT_PROTOCOL_ERROR, "FTP error: " + describe(e));
            }
        }
    }

    private void checkPath(FtpClient client, String path, ProbeResult.Builder result) {
        try {
            client.changeDirectory(path);
            result.pathExists(true).pathType(PathType.DIRECTORY);
            return;
        } catch (ProtocolException e) {
            if (e.getErrorType() != ProtocolException.ErrorType.PERMISSION_DENIED) {
                result.pathExists(false).addError(ErrorKind.PATH_CHECK_ERROR, "Path check error: " + describe(e));
                return;
            }
        } catch (RuntimeException e) {
            result.pathExists(false).addError(ErrorKind.PATH_CHECK_ERROR, "Path check error: " + describe(e));
            return;
        }

        String parent = parentOf(path);
        String fileName = fileNameOf(path);
        try {
            client.changeDirectory(parent);
            List<String> names = client.listNames();
            if (names.contains(fileName)) {
                result.pathExists(true).pathType(PathType.FILE);
            } else {
                result.pathExists(false).addError(ErrorKind.PATH_CHECK_ERROR, "Path '" + path + "' not found");
            }
        } catch (ProtocolException e) {
            String prefix = e.getErrorType() == ProtocolException.ErrorType.PERMISSION_DENIED
                    ? "Error accessing parent directory: "
                    : "Path check error: ";
            result.pathExists(false).addError(ErrorKind.PATH_CHECK_ERROR, prefix + describe(e));
        } catch (RuntimeException e) {
            result.pathExists(false).addError(ErrorKind.PATH_CHECK_ERROR, "Path check error: " + describe(e));
        }
    }

    /**
     * "/a/b/c.txt" -> "/a/b", "/c.txt" -> "/", "c.txt" -> "/".
     */
    static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash > 0 ? path.substring(0, slash) : "/";
    }

    static String fileNameOf(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
