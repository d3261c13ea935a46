package probe.protocol;

import model.Protocol;

/**
 * SFTP capability surface.
 *
 * <p>The SSH transport binds connection and authentication into one handshake,
 * so {@link #connect(String, int, String, String, int)} performs both.
 */
public interface SftpClient extends ProtocolClient {

    @Override
    default Protocol getProtocol() {
        return Protocol.SFTP;
    }

    /**
     * Open the SSH session and authenticate with a password.
     *
     * @throws ProtocolException AUTHENTICATION_FAILED, CONNECTION_TIMEOUT,
     *                           HOST_RESOLUTION_FAILED, CONNECTION_FAILED or PROTOCOL_ERROR
     */
    void connect(String host, int port, String username, String password, int timeoutMs)
            throws ProtocolException;

    /**
     * Stat a remote path over an SFTP channel.
     *
     * @param path remote path
     * @return attributes of the path
     * @throws ProtocolException NOT_FOUND if the path does not exist
     */
    RemoteFileAttributes stat(String path) throws ProtocolException;
}
