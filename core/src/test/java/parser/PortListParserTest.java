package parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PortListParserTest {

    @Test
    void testCommaSeparatedList() throws Exception {
        assertEquals(List.of(21, 2121, 990), PortListParser.parse("21, 2121,990"));
    }

    @Test
    void testNonNumericEntriesAreDropped() throws Exception {
        assertEquals(List.of(21, 22), PortListParser.parse("21,ftp,,22"));
    }

    @Test
    void testOutOfRangePort() {
        assertThrows(ConfigurationException.class, () -> PortListParser.parse("21,70000"));
        assertThrows(ConfigurationException.class, () -> PortListParser.parse("0"));
    }

    @Test
    void testNothingUsable() {
        assertThrows(ConfigurationException.class, () -> PortListParser.parse("ftp,ssh"));
        assertThrows(ConfigurationException.class, () -> PortListParser.parse(" "));
    }

    @Test
    void testPortsFromFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("ports.txt");
        Files.writeString(file, "# common\n21\n2121\n\n");

        assertEquals(List.of(21, 2121), PortListParser.parse(file.toString()));
    }

    @Test
    void testInvalidLineInFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("ports.txt");
        Files.writeString(file, "21\nssh\n");

        assertThrows(ConfigurationException.class, () -> PortListParser.parse(file.toString()));
    }
}
