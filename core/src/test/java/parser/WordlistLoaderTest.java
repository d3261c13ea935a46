package parser;

import model.Credential;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WordlistLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testTrimsAndSkipsBlankAndCommentLines() throws Exception {
        Path file = tempDir.resolve("users.txt");
        Files.writeString(file, "admin\n  root  \n\n# comment\n   \nguest\n");

        assertEquals(List.of("admin", "root", "guest"), WordlistLoader.load(file));
    }

    @Test
    void testMalformedBytesAreIgnored() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        bytes.write("pa".getBytes(StandardCharsets.UTF_8));
        bytes.write(0xFF);
        bytes.write("ss\nпароль\n".getBytes(StandardCharsets.UTF_8));
        Path file = tempDir.resolve("pass.txt");
        Files.write(file, bytes.toByteArray());

        assertEquals(List.of("pass", "пароль"), WordlistLoader.load(file));
    }

    @Test
    void testUnreadableFile() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> WordlistLoader.load(tempDir.resolve("missing.txt")));
        assertTrue(e.getMessage().startsWith("Error reading wordlist"));
    }

    @Test
    void testLoadCombos() throws Exception {
        Path file = tempDir.resolve("combos.txt");
        Files.writeString(file, "admin:admin\n root : toor \nbroken\nuser:pa:ss\nanon:\n");

        assertEquals(List.of(
            new Credential("admin", "admin"),
            new Credential("root", "toor"),
            new Credential("user", "pa:ss"),
            new Credential("anon", "")), WordlistLoader.loadCombos(file));
    }

    @Test
    void testParseComboWithoutColon() {
        assertNull(WordlistLoader.parseCombo("nocolon"));
    }
}
