package model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProbeResultTest {

    private static final ProbeDescriptor DESCRIPTOR =
        new ProbeDescriptor(new Endpoint("h", 21, Protocol.FTP), new Credential("u", "p"), "/pub");

    @Test
    void testAuthenticationRequiresConnection() {
        ProbeResult.Builder builder = ProbeResult.builder(DESCRIPTOR).authentication(true);

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void testPathResultRequiresCheckPath() {
        ProbeDescriptor withoutPath = new ProbeDescriptor(new Endpoint("h", 21, Protocol.FTP), new Credential("u", "p"));

        assertThrows(IllegalStateException.class,
            () -> ProbeResult.builder(withoutPath).connection(true).authentication(true).pathExists(true).build());
    }

    @Test
    void testIdentityCopiedFromDescriptor() {
        ProbeResult result = ProbeResult.builder(DESCRIPTOR)
            .connection(true)
            .addError(ErrorKind.AUTHENTICATION_FAILURE, "FTP error: 530 Login incorrect")
            .build();

        assertEquals("h", result.getHost());
        assertEquals(21, result.getPort());
        assertEquals("u", result.getUsername());
        assertEquals("p", result.getPassword());
        assertEquals(Protocol.FTP, result.getProtocol());
        assertEquals("/pub", result.getCheckPath());
        assertFalse(result.isSuccessful());
        assertFalse(result.isPathChecked());
        assertEquals(List.of("FTP error: 530 Login incorrect"), result.getErrors());
        assertThrows(UnsupportedOperationException.class, () -> result.getFeatures().add("x"));
    }

    @Test
    void testFailureFactory() {
        ProbeResult result = ProbeResult.failure(DESCRIPTOR, "Check failed: boom");

        assertFalse(result.isConnection());
        assertEquals(ErrorKind.UNEXPECTED_ERROR, result.getErrorDetails().get(0).kind());
    }

    @Test
    void testEndpointValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Endpoint("h", 0, Protocol.FTP));
        assertThrows(IllegalArgumentException.class, () -> new Endpoint(" ", 21, Protocol.FTP));
        assertEquals(22, Endpoint.of("h", Protocol.SFTP).port());
    }

    @Test
    void testProtocolCodes() {
        assertEquals(Protocol.SFTP, Protocol.fromCode(1));
        assertThrows(IllegalArgumentException.class, () -> Protocol.fromCode(2));
    }

    @Test
    void testDescriptorToStringHidesPassword() {
        assertEquals("u@h:21 (FTP)", DESCRIPTOR.toString());
        assertFalse(DESCRIPTOR.credential().toString().contains("p'"));
    }
}
