package probe.protocol;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RemoteFileAttributesTest {

    @Test
    void testFileTypeFromMode() {
        assertTrue(new RemoteFileAttributes(0040755).isDirectory());
        assertFalse(new RemoteFileAttributes(0100644).isDirectory());
        // сокет: бит каталога установлен, но тип другой
        assertFalse(new RemoteFileAttributes(0140755).isDirectory());
    }

    @Test
    void testMissingPermissions() {
        RemoteFileAttributes attributes = new RemoteFileAttributes(null);

        assertFalse(attributes.hasPermissions());
        assertFalse(attributes.isDirectory());
    }
}
