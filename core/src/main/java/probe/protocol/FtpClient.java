package probe.protocol;

import model.Protocol;

import java.util.List;

/**
 * FTP capability surface: separate connect and login steps, banner, FEAT, CWD and NLST.
 */
public interface FtpClient extends ProtocolClient {

    @Override
    default Protocol getProtocol() {
        return Protocol.FTP;
    }

    /**
     * Open the control connection and read the server greeting.
     *
     * @param host server host
     * @param port server port
     * @param timeoutMs connect timeout; also applied to subsequent replies
     * @throws ProtocolException CONNECTION_TIMEOUT, HOST_RESOLUTION_FAILED or CONNECTION_FAILED
     */
    void connect(String host, int port, int timeoutMs) throws ProtocolException;

    /**
     * @return the greeting sent by the server on connect, or null if none was received
     */
    String getWelcomeMessage();

    /**
     * Send USER/PASS.
     *
     * @throws ProtocolException AUTHENTICATION_FAILED if the server rejects the credentials
     */
    void login(String username, String password) throws ProtocolException;

    /**
     * Query the FEAT list.
     *
     * @return advertised features, one entry per line, without the surrounding 211 lines
     * @throws ProtocolException NOT_SUPPORTED if the server rejects FEAT
     */
    List<String> listFeatures() throws ProtocolException;

    /**
     * Change the working directory.
     *
     * @throws ProtocolException PERMISSION_DENIED if the server rejects the directory
     */
    void changeDirectory(String path) throws ProtocolException;

    /**
     * List entry names of the current working directory (NLST).
     *
     * @return entry names as returned by the server, empty for an empty directory
     * @throws ProtocolException PERMISSION_DENIED if the directory cannot be listed
     */
    List<String> listNames() throws ProtocolException;
}
