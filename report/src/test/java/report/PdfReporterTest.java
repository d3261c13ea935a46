package report;

import model.Credential;
import model.Endpoint;
import model.ProbeDescriptor;
import model.ProbeResult;
import model.Protocol;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PdfReporterTest {

    @Test
    void testGeneratesReadablePdf() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new PdfReporter().generateToOutputStream(ReportFixtures.report(), out);

        try (PDDocument document = Loader.loadPDF(out.toByteArray())) {
            assertTrue(document.getNumberOfPages() >= 1);
            String text = new PDFTextStripper().getText(document);
            assertTrue(text.contains("ftp.example.com"));
            assertTrue(text.contains("Authentication failed"));
            assertTrue(text.contains("Password: s3cret"));
            assertTrue(text.contains("Timestamp: 2024-05-01T10:15:30Z"));
        }
    }

    @Test
    void testLongFeatureListIsWrapped() throws Exception {
        List<String> features = IntStream.rangeClosed(1, 60)
            .mapToObj(i -> String.format("FEATURE_%02d", i))
            .toList();
        ProbeResult result = ProbeResult.builder(new ProbeDescriptor(
                new Endpoint("ftp.example.com", 21, Protocol.FTP), new Credential("alice", "s3cret")))
            .timestamp(ReportFixtures.GENERATED_AT)
            .connection(true)
            .features(features)
            .build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new PdfReporter().generateToOutputStream(new ProbeReport(List.of(result), ReportFixtures.GENERATED_AT), out);

        try (PDDocument document = Loader.loadPDF(out.toByteArray())) {
            List<String> lines = new PDFTextStripper().getText(document).lines().toList();
            assertTrue(lines.stream().anyMatch(l -> l.contains("Features (60): FEATURE_01")));
            assertTrue(lines.stream().anyMatch(l -> l.contains("FEATURE_60")));
            assertTrue(lines.stream().noneMatch(l -> l.contains("FEATURE_01") && l.contains("FEATURE_60")));
        }
    }

    @Test
    void testTextOutputIsRejected() throws Exception {
        StringWriter buffer = new StringWriter();
        new PdfReporter().generate(ReportFixtures.report(), new PrintWriter(buffer));

        assertFalse(buffer.toString().isEmpty());
        assertTrue(ReportFormat.PDF.isBinary());
    }

    @Test
    void testSanitizeReplacesNonAsciiCharacters() {
        assertEquals("caf? ok", PdfReporter.sanitize("café ok"));
        assertEquals("", PdfReporter.sanitize(null));
    }
}
