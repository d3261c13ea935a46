package util;

import org.junit.jupiter.api.Test;
import report.ReportFormat;

import static org.junit.jupiter.api.Assertions.*;

class FormatParserTest {

    @Test
    void testKnownFormats() {
        assertEquals(ReportFormat.TEXT, FormatParser.parse(null));
        assertEquals(ReportFormat.TEXT, FormatParser.parse("console"));
        assertEquals(ReportFormat.TEXT, FormatParser.parse("TXT"));
        assertEquals(ReportFormat.JSON, FormatParser.parse(" json "));
        assertEquals(ReportFormat.CSV, FormatParser.parse("csv"));
        assertEquals(ReportFormat.PDF, FormatParser.parse("Pdf"));
    }

    @Test
    void testUnknownFormat() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> FormatParser.parse("html"));
        assertTrue(e.getMessage().startsWith("Unknown report format"));
    }
}
