package probe.checker;

import model.Protocol;
import org.junit.jupiter.api.Test;
import probe.protocol.FtpClient;
import probe.protocol.ProtocolClientFactory;
import probe.protocol.ProtocolRegistry;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class CheckerRegistryTest {

    @Test
    void testLookupByProtocol() {
        FtpChecker ftp = new FtpChecker(() -> mock(FtpClient.class));
        CheckerRegistry registry = new CheckerRegistry(List.of(ftp));

        assertSame(ftp, registry.getChecker(Protocol.FTP));
        assertTrue(registry.supports(Protocol.FTP));
        assertFalse(registry.supports(Protocol.SFTP));
        assertEquals(Set.of(Protocol.FTP), registry.getSupportedProtocols());
    }

    @Test
    void testMissingCheckerThrows() {
        CheckerRegistry registry = new CheckerRegistry(List.of());

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> registry.getChecker(Protocol.SFTP));
        assertEquals("No checker available for protocol SFTP", e.getMessage());
    }

    @Test
    void testBuiltFromProtocolRegistry() {
        ProtocolRegistry protocols = new ProtocolRegistry();
        protocols.register(new ProtocolClientFactory<FtpClient>() {
            @Override
            public Protocol getProtocol() {
                return Protocol.FTP;
            }

            @Override
            public FtpClient createClient() {
                return mock(FtpClient.class);
            }
        });

        CheckerRegistry registry = CheckerRegistry.fromProtocolRegistry(protocols);

        assertInstanceOf(FtpChecker.class, registry.getChecker(Protocol.FTP));
        assertFalse(registry.supports(Protocol.SFTP));
    }
}
