package report;

import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvReporterTest {

    @Test
    void testHeaderAndRows() throws Exception {
        StringWriter buffer = new StringWriter();
        new CsvReporter().generate(ReportFixtures.report(), new PrintWriter(buffer));
        List<String> lines = buffer.toString().lines().toList();

        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("Host,Port,Username,Password,Protocol,Timestamp,Connection,"));
        assertTrue(lines.get(0).contains("Connection Time (ms)"));
        assertTrue(lines.get(0).contains("Welcome Message"));
        assertTrue(lines.get(0).endsWith(",Features,Errors"));
        assertTrue(lines.get(1).startsWith(
            "ftp.example.com,21,alice,s3cret,FTP,2024-05-01T10:15:30Z,Success,12.5,Success,30.25,/pub,Yes,directory,4.0,50.0,"));
        assertTrue(lines.get(1).contains("220 xxx"));
        assertTrue(lines.get(1).endsWith(",3,"));
        assertTrue(lines.get(2).startsWith(
            "sftp.example.com,2222,bob,wrong,SFTP,2024-05-01T10:15:30Z,Failed,,Failed,,,N/A,,,8.0,,0,"));
        assertTrue(lines.get(2).endsWith("\"Authentication failed; Unexpected error: boom\""));
    }
}
