package probe.protocol.ftp;

import org.junit.jupiter.api.Test;
import probe.protocol.ProtocolException;
import probe.protocol.ProtocolException.ErrorType;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommonsNetFtpClientTest {

    private static final int TIMEOUT_MS = 5000;

    @Test
    void testLoginFeaturesAndDirectory() throws Exception {
        try (ScriptedFtpServer server = new ScriptedFtpServer("220 Test FTP ready")
                .reply("USER alice", "331 Password required")
                .reply("PASS secret", "230 Logged in")
                .reply("FEAT", "211-Features:\r\n UTF8\r\n MLST type*;size*;\r\n211 End")
                .reply("CWD /pub", "250 Directory changed")
                .start();
             CommonsNetFtpClient client = new CommonsNetFtpClient()) {

            client.connect("127.0.0.1", server.getPort(), TIMEOUT_MS);
            assertTrue(client.isConnected());
            assertEquals("220 Test FTP ready", client.getWelcomeMessage());

            client.login("alice", "secret");
            assertEquals(List.of("UTF8", "MLST type*;size*;"), client.listFeatures());
            client.changeDirectory("/pub");

            assertTrue(server.getReceived().contains("CWD /pub"));
        }
    }

    @Test
    void testRejectedPassword() throws Exception {
        try (ScriptedFtpServer server = new ScriptedFtpServer("220 ready")
                .reply("USER alice", "331 Password required")
                .reply("PASS", "530 Login incorrect")
                .start();
             CommonsNetFtpClient client = new CommonsNetFtpClient()) {

            client.connect("127.0.0.1", server.getPort(), TIMEOUT_MS);
            ProtocolException e = assertThrows(ProtocolException.class, () -> client.login("alice", "wrong"));

            assertEquals(ErrorType.AUTHENTICATION_FAILED, e.getErrorType());
            assertEquals("530 Login incorrect", e.getMessage());
        }
    }

    @Test
    void testTransientLoginFailureIsProtocolError() throws Exception {
        try (ScriptedFtpServer server = new ScriptedFtpServer("220 ready")
                .reply("USER", "421 Too many connections")
                .start();
             CommonsNetFtpClient client = new CommonsNetFtpClient()) {

            client.connect("127.0.0.1", server.getPort(), TIMEOUT_MS);
            ProtocolException e = assertThrows(ProtocolException.class, () -> client.login("alice", "pw"));

            assertNotEquals(ErrorType.AUTHENTICATION_FAILED, e.getErrorType());
        }
    }

    @Test
    void testFeatNotSupportedAndCwdRefused() throws Exception {
        try (ScriptedFtpServer server = new ScriptedFtpServer("220 ready")
                .reply("USER", "230 Logged in")
                .reply("CWD /data/file.txt", "550 Not a directory")
                .start();
             CommonsNetFtpClient client = new CommonsNetFtpClient()) {

            client.connect("127.0.0.1", server.getPort(), TIMEOUT_MS);
            client.login("anonymous", "");

            ProtocolException feat = assertThrows(ProtocolException.class, client::listFeatures);
            assertEquals(ErrorType.NOT_SUPPORTED, feat.getErrorType());

            ProtocolException cwd = assertThrows(ProtocolException.class,
                () -> client.changeDirectory("/data/file.txt"));
            assertEquals(ErrorType.PERMISSION_DENIED, cwd.getErrorType());
            assertEquals("550 Not a directory", cwd.getMessage());
        }
    }

    @Test
    void testNegativeGreeting() throws Exception {
        try (ScriptedFtpServer server = new ScriptedFtpServer("530 Not allowed from your address").start();
             CommonsNetFtpClient client = new CommonsNetFtpClient()) {

            ProtocolException e = assertThrows(ProtocolException.class,
                () -> client.connect("127.0.0.1", server.getPort(), TIMEOUT_MS));

            assertEquals(ErrorType.CONNECTION_FAILED, e.getErrorType());
            assertFalse(client.isConnected());
        }
    }

    @Test
    void testConnectionRefused() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        try (CommonsNetFtpClient client = new CommonsNetFtpClient()) {
            ProtocolException e = assertThrows(ProtocolException.class,
                () -> client.connect("127.0.0.1", port, TIMEOUT_MS));
            assertEquals(ErrorType.CONNECTION_FAILED, e.getErrorType());
        }
    }

    @Test
    void testCloseWithoutConnectIsNoOp() {
        CommonsNetFtpClient client = new CommonsNetFtpClient();

        assertDoesNotThrow(client::close);
        assertFalse(client.isConnected());
    }

    @Test
    void testParseFeatures() {
        assertEquals(List.of("UTF8", "SIZE"),
            CommonsNetFtpClient.parseFeatures(new String[]{"211-Features:", " UTF8", "", " SIZE", "211 End"}));
        assertTrue(CommonsNetFtpClient.parseFeatures(new String[]{"211 No features"}).isEmpty());
        assertTrue(CommonsNetFtpClient.parseFeatures(null).isEmpty());
    }
}
