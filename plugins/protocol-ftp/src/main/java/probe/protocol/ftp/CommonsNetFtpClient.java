package probe.protocol.ftp;

import model.Protocol;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPConnectionClosedException;
import org.apache.commons.net.ftp.FTPReply;
import probe.protocol.FtpClient;
import probe.protocol.ProtocolException;
import probe.protocol.ProtocolException.ErrorType;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * Apache Commons Net FTP client.
 *
 * <p>Reply codes are translated into {@link ErrorType}s:
 * <ul>
 *   <li>5xx after PASS - {@code AUTHENTICATION_FAILED}</li>
 *   <li>5xx after FEAT - {@code NOT_SUPPORTED}</li>
 *   <li>5xx after CWD/NLST - {@code PERMISSION_DENIED}</li>
 *   <li>other negative replies - {@code PROTOCOL_ERROR}</li>
 * </ul>
 * Data connections use passive mode.
 */
public class CommonsNetFtpClient implements FtpClient {
    private static final Logger logger = Logger.getLogger(CommonsNetFtpClient.class.getName());

    private final FTPClient client;
    private String welcomeMessage;

    public CommonsNetFtpClient() {
        this(new FTPClient());
    }

    CommonsNetFtpClient(FTPClient client) {
        this.client = client;
        this.client.setControlEncoding(StandardCharsets.UTF_8.name());
    }

    @Override
    public void connect(String host, int port, int timeoutMs) throws ProtocolException {
        client.setConnectTimeout(timeoutMs);
        client.setDefaultTimeout(timeoutMs);
        client.setDataTimeout(Duration.ofMillis(timeoutMs));

        try {
            client.connect(host, port);
            client.setSoTimeout(timeoutMs);
        } catch (SocketTimeoutException e) {
            throw new ProtocolException(Protocol.FTP, ErrorType.CONNECTION_TIMEOUT, "Connection timed out", e);
        } catch (UnknownHostException e) {
            throw new ProtocolException(Protocol.FTP, ErrorType.HOST_RESOLUTION_FAILED,
                    "Unknown host: " + host, e);
        } catch (IOException e) {
            throw new ProtocolException(Protocol.FTP, ErrorType.CONNECTION_FAILED, message(e), e);
        }

        int reply = client.getReplyCode();
        if (!FTPReply.isPositiveCompletion(reply)) {
            String replyString = reply();
            close();
            throw new ProtocolException(Protocol.FTP, ErrorType.CONNECTION_FAILED, replyString);
        }

        welcomeMessage = reply();
        client.enterLocalPassiveMode();
        logger.fine("Connected to " + host + ":" + port);
    }

    @Override
    public String getWelcomeMessage() {
        return welcomeMessage;
    }

    @Override
    public void login(String username, String password) throws ProtocolException {
        boolean loggedIn;
        try {
            loggedIn = client.login(username, password);
        } catch (IOException e) {
            throw ioFailure(e);
        }
        if (!loggedIn) {
            ErrorType type = FTPReply.isNegativePermanent(client.getReplyCode())
                    ? ErrorType.AUTHENTICATION_FAILED
                    : ErrorType.PROTOCOL_ERROR;
            throw new ProtocolException(Protocol.FTP, type, reply());
        }
    }

    @Override
    public List<String> listFeatures() throws ProtocolException {
        boolean supported;
        try {
            supported = client.features();
        } catch (IOException e) {
            throw ioFailure(e);
        }
        if (!supported) {
            throw negativeReply(ErrorType.NOT_SUPPORTED);
        }
        return parseFeatures(client.getReplyStrings());
    }

    /**
     * Multi-line FEAT reply: first and last lines are the 211 envelope.
     */
    static List<String> parseFeatures(String[] replyLines) {
        List<String> features = new ArrayList<>();
        if (replyLines == null || replyLines.length < 3) {
            return features;
        }
        for (String line : Arrays.copyOfRange(replyLines, 1, replyLines.length - 1)) {
            String feature = line.trim();
            if (!feature.isEmpty()) {
                features.add(feature);
            }
        }
        return features;
    }

    @Override
    public void changeDirectory(String path) throws ProtocolException {
        boolean changed;
        try {
            changed = client.changeWorkingDirectory(path);
        } catch (IOException e) {
            throw ioFailure(e);
        }
        if (!changed) {
            throw negativeReply(ErrorType.PERMISSION_DENIED);
        }
    }

    @Override
    public List<String> listNames() throws ProtocolException {
        String[] names;
        try {
            names = client.listNames();
        } catch (IOException e) {
            throw ioFailure(e);
        }
        if (names == null) {
            throw negativeReply(ErrorType.PERMISSION_DENIED);
        }
        return List.of(names);
    }

    @Override
    public boolean isConnected() {
        return client.isConnected();
    }

    @Override
    public void close() {
        if (!client.isConnected()) {
            return;
        }
        try {
            client.logout();
        } catch (IOException e) {
            logger.fine("Error during FTP logout: " + e.getMessage());
        }
        try {
            client.disconnect();
        } catch (IOException e) {
            logger.fine("Error during FTP disconnect: " + e.getMessage());
        }
    }

    @Override
    public String getDescription() {
        return "Apache Commons Net FTP Client";
    }

    private ProtocolException negativeReply(ErrorType permanentType) {
        ErrorType type = FTPReply.isNegativePermanent(client.getReplyCode()) ? permanentType : ErrorType.PROTOCOL_ERROR;
        return new ProtocolException(Protocol.FTP, type, reply());
    }

    private static ProtocolException ioFailure(IOException e) {
        if (e instanceof SocketTimeoutException) {
            return new ProtocolException(Protocol.FTP, ErrorType.CONNECTION_TIMEOUT, "Connection timed out", e);
        }
        if (e instanceof FTPConnectionClosedException) {
            return new ProtocolException(Protocol.FTP, ErrorType.PROTOCOL_ERROR, "Connection closed: " + message(e), e);
        }
        return new ProtocolException(Protocol.FTP, ErrorType.PROTOCOL_ERROR, message(e), e);
    }

    private String reply() {
        String reply = client.getReplyString();
        return reply != null ? reply.trim() : "";
    }

    private static String message(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
