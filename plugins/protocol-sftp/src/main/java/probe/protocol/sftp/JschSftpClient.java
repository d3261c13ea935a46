package probe.protocol.sftp;

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpATTRS;
import com.jcraft.jsch.SftpException;
import com.jcraft.jsch.UIKeyboardInteractive;
import com.jcraft.jsch.UserInfo;
import model.Protocol;
import probe.protocol.ProtocolException;
import probe.protocol.ProtocolException.ErrorType;
import probe.protocol.RemoteFileAttributes;
import probe.protocol.SftpClient;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.logging.Logger;

/**
 * JSch SFTP client. Host keys are not verified.
 *
 * <p>The SSH session is authenticated during {@link #connect}; the SFTP channel
 * is opened lazily on the first {@link #stat}.
 */
public class JschSftpClient implements SftpClient {
    private static final Logger logger = Logger.getLogger(JschSftpClient.class.getName());

    private final JSch jsch;
    private Session session;
    private ChannelSftp channel;
    private int timeoutMs;

    public JschSftpClient() {
        this(new JSch());
    }

    JschSftpClient(JSch jsch) {
        this.jsch = jsch;
    }

    @Override
    public void connect(String host, int port, String username, String password, int timeoutMs)
            throws ProtocolException {
        this.timeoutMs = timeoutMs;
        try {
            session = jsch.getSession(username, host, port);
            session.setPassword(password);
            session.setUserInfo(new PasswordUserInfo(password));
            session.setConfig("StrictHostKeyChecking", "no");
            session.setConfig("PreferredAuthentications", "password,keyboard-interactive");
            session.setTimeout(timeoutMs);
            session.connect(timeoutMs);
            logger.fine("SSH session established to " + host + ":" + port);
        } catch (JSchException e) {
            close();
            throw translate(e);
        }
    }

    @Override
    public RemoteFileAttributes stat(String path) throws ProtocolException {
        if (session == null || !session.isConnected()) {
            throw new ProtocolException(Protocol.SFTP, ErrorType.PROTOCOL_ERROR, "Not connected");
        }
        try {
            SftpATTRS attrs = openChannel().stat(path);
            boolean hasPermissions = (attrs.getFlags() & SftpATTRS.SSH_FILEXFER_ATTR_PERMISSIONS) != 0;
            return new RemoteFileAttributes(hasPermissions ? attrs.getPermissions() : null);
        } catch (SftpException e) {
            ErrorType type = switch (e.id) {
                case ChannelSftp.SSH_FX_NO_SUCH_FILE -> ErrorType.NOT_FOUND;
                case ChannelSftp.SSH_FX_PERMISSION_DENIED -> ErrorType.PERMISSION_DENIED;
                default -> ErrorType.PROTOCOL_ERROR;
            };
            throw new ProtocolException(Protocol.SFTP, type, message(e), e);
        } catch (JSchException e) {
            throw translate(e);
        }
    }

    private ChannelSftp openChannel() throws JSchException {
        if (channel == null || !channel.isConnected()) {
            channel = (ChannelSftp) session.openChannel("sftp");
            channel.connect(timeoutMs);
        }
        return channel;
    }

    static ProtocolException translate(JSchException e) {
        String message = message(e);
        Throwable cause = e.getCause();
        if (message.startsWith("Auth fail") || message.startsWith("Auth cancel")) {
            return new ProtocolException(Protocol.SFTP, ErrorType.AUTHENTICATION_FAILED, message, e);
        }
        if (cause instanceof SocketTimeoutException || message.startsWith("timeout")) {
            return new ProtocolException(Protocol.SFTP, ErrorType.CONNECTION_TIMEOUT, message, e);
        }
        if (cause instanceof UnknownHostException) {
            return new ProtocolException(Protocol.SFTP, ErrorType.HOST_RESOLUTION_FAILED, message, e);
        }
        if (cause instanceof ConnectException) {
            return new ProtocolException(Protocol.SFTP, ErrorType.CONNECTION_FAILED, message, e);
        }
        return new ProtocolException(Protocol.SFTP, ErrorType.PROTOCOL_ERROR, message, e);
    }

    @Override
    public boolean isConnected() {
        return session != null && session.isConnected();
    }

    @Override
    public void close() {
        if (channel != null) {
            channel.disconnect();
            channel = null;
        }
        if (session != null) {
            session.disconnect();
            session = null;
        }
    }

    @Override
    public String getDescription() {
        return "JSch SFTP Client";
    }

    private static String message(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Answers keyboard-interactive prompts with the password.
     */
    private static final class PasswordUserInfo implements UserInfo, UIKeyboardInteractive {
        private final String password;

        PasswordUserInfo(String password) {
            this.password = password;
        }

        @Override
        public String getPassphrase() {
            return null;
        }

        @Override
        public String getPassword() {
            return password;
        }

        @Override
        public boolean promptPassword(String message) {
            return true;
        }

        @Override
        public boolean promptPassphrase(String message) {
            return false;
        }

        @Override
        public boolean promptYesNo(String message) {
            return true;
        }

        @Override
        public void showMessage(String message) {
            logger.finer("SSH server message: " + message);
        }

        @Override
        public String[] promptKeyboardInteractive(String destination, String name, String instruction,
                                                  String[] prompt, boolean[] echo) {
            String[] answers = new String[prompt.length];
            Arrays.fill(answers, password);
            return answers;
        }
    }
}
