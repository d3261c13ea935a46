package report;

import model.ProbeResult;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import util.StringUtils;

import java.awt.Color;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * PDF отчет: титульная страница со сводкой и по блоку на каждый результат.
 *
 * <p>Используются стандартные шрифты PDF, поэтому символы вне печатного ASCII
 * заменяются на '?'.
 *
 * <p>Экземпляр хранит состояние документа во время генерации и не потокобезопасен.
 */
public final class PdfReporter implements Reporter {

    private static final float MARGIN = 50;
    private static final float PAGE_HEIGHT = PDRectangle.A4.getHeight();
    private static final float PAGE_WIDTH = PDRectangle.A4.getWidth();
    private static final float LINE_HEIGHT = 14;
    private static final DateTimeFormatter DATE_FORMATTER =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private static final Color SUCCESS_COLOR = new Color(22, 163, 74);
    private static final Color FAILURE_COLOR = new Color(220, 38, 38);

    private PDDocument document;
    private PDPageContentStream currentContent;
    private float yPosition;

    private final PDFont regularFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
    private final PDFont boldFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
    private final PDFont monoFont = new PDType1Font(Standard14Fonts.FontName.COURIER);

    // Font state tracking
    private PDFont currentFont;
    private float currentFontSize;

    /**
     * PDF - бинарный формат, в текстовый поток не пишется.
     * Используйте {@link #generateToOutputStream(ProbeReport, OutputStream)}.
     */
    @Override
    public void generate(ProbeReport report, PrintWriter writer) throws IOException {
        writer.println("PDF format requires binary output. Use generateToOutputStream() method instead.");
    }

    /**
     * Генерирует PDF-отчет и записывает его в указанный поток вывода.
     *
     * @param report снимок результатов
     * @param outputStream поток вывода (не закрывается)
     * @throws IOException если возникла ошибка при генерации или записи PDF
     */
    public void generateToOutputStream(ProbeReport report, OutputStream outputStream) throws IOException {
        document = new PDDocument();
        currentContent = null;
        currentFont = null;

        try {
            generateTitlePage(report);

            int index = 1;
            for (ProbeResult result : report.getResults()) {
                drawResult(index++, result);
            }

            closeCurrentContent();
            document.save(outputStream);
        } finally {
            closeCurrentContent();
            document.close();
        }
    }

    private void generateTitlePage(ProbeReport report) throws IOException {
        addNewPage();

        setFont(boldFont, 24);
        drawText("FTP/SFTP Check Results", MARGIN, yPosition);
        yPosition -= 40;

        setFont(regularFont, 12);
        drawText("Report Date: " + DATE_FORMATTER.format(report.getGeneratedAt()), MARGIN, yPosition);
        yPosition -= 30;

        ReportSummary summary = report.getSummary();
        setFont(boldFont, 14);
        drawText("Summary Statistics:", MARGIN, yPosition);
        yPosition -= 22;

        setFont(regularFont, 12);
        drawText("Total servers: " + summary.total(), MARGIN + 10, yPosition);
        yPosition -= 18;
        drawColoredText("Successful connections: " + summary.successful(), MARGIN + 10, SUCCESS_COLOR);
        yPosition -= 18;
        drawColoredText("Failed connections: " + summary.failed(), MARGIN + 10, FAILURE_COLOR);
        yPosition -= 36;
    }

    private void drawResult(int index, ProbeResult result) throws IOException {
        checkPageSpace(10 * LINE_HEIGHT);

        setFont(boldFont, 12);
        drawText("Server " + index + ": " + result.getUsername() + "@" + result.getHost() + ":"
            + result.getPort() + " (" + result.getProtocol() + ")", MARGIN, yPosition);
        yPosition -= LINE_HEIGHT + 2;

        setFont(regularFont, 10);
        drawText("Password: " + result.getPassword(), MARGIN + 10, yPosition);
        yPosition -= LINE_HEIGHT;
        drawText("Timestamp: " + result.getTimestamp(), MARGIN + 10, yPosition);
        yPosition -= LINE_HEIGHT;
        drawColoredText("Connection: " + (result.isConnection() ? "Success" : "Failed")
                + millis(result.getConnectionTimeMs()),
            MARGIN + 10, result.isConnection() ? SUCCESS_COLOR : FAILURE_COLOR);
        yPosition -= LINE_HEIGHT;
        drawColoredText("Authentication: " + (result.isAuthentication() ? "Success" : "Failed")
                + millis(result.getAuthTimeMs()),
            MARGIN + 10, result.isAuthentication() ? SUCCESS_COLOR : FAILURE_COLOR);
        yPosition -= LINE_HEIGHT;

        if (result.isPathChecked()) {
            String type = result.getPathType() != null ? " [Type: " + result.getPathType().getDisplayName() + "]" : "";
            drawText("Path check " + result.getCheckPath() + ": "
                + (Boolean.TRUE.equals(result.getPathExists()) ? "Exists" : "Missing")
                + millis(result.getPathCheckTimeMs()) + type, MARGIN + 10, yPosition);
            yPosition -= LINE_HEIGHT;
        }

        if (StringUtils.isNotEmpty(result.getWelcomeMessage())) {
            setFont(monoFont, 9);
            drawWrappedText("Welcome: " + StringUtils.abbreviate(result.getWelcomeMessage(),
                TextReporter.WELCOME_MAX_LENGTH), MARGIN + 10, PAGE_WIDTH - 2 * MARGIN - 10);
            setFont(regularFont, 10);
        }

        if (!result.getFeatures().isEmpty()) {
            drawWrappedText("Features (" + result.getFeatures().size() + "): "
                + String.join(", ", result.getFeatures()), MARGIN + 10, PAGE_WIDTH - 2 * MARGIN - 10);
        }

        drawText("Total time: " + (result.getTotalTimeMs() != null ? result.getTotalTimeMs() + "ms" : "N/A"),
            MARGIN + 10, yPosition);
        yPosition -= LINE_HEIGHT;

        for (String error : result.getErrors()) {
            checkPageSpace(LINE_HEIGHT);
            drawColoredText("- " + error, MARGIN + 20, FAILURE_COLOR);
            yPosition -= LINE_HEIGHT;
        }

        yPosition -= LINE_HEIGHT;
    }

    private void closeCurrentContent() throws IOException {
        if (currentContent != null) {
            currentContent.close();
            currentContent = null;
        }
    }

    private void addNewPage() throws IOException {
        PDFont savedFont = currentFont;
        float savedFontSize = currentFontSize;

        closeCurrentContent();
        PDPage page = new PDPage(PDRectangle.A4);
        document.addPage(page);
        currentContent = new PDPageContentStream(document, page);
        yPosition = PAGE_HEIGHT - 80;

        if (savedFont != null && savedFontSize > 0) {
            setFont(savedFont, savedFontSize);
        }
    }

    private void checkPageSpace(float neededSpace) throws IOException {
        if (yPosition < MARGIN + neededSpace) {
            addNewPage();
        }
    }

    private void setFont(PDFont font, float size) throws IOException {
        currentFont = font;
        currentFontSize = size;
        currentContent.setFont(font, size);
    }

    private void drawColoredText(String text, float x, Color color) throws IOException {
        currentContent.setNonStrokingColor(color);
        drawText(text, x, yPosition);
        currentContent.setNonStrokingColor(Color.BLACK);
    }

    private void drawText(String text, float x, float y) throws IOException {
        currentContent.beginText();
        try {
            currentContent.newLineAtOffset(x, y);
            currentContent.showText(sanitize(text));
        } finally {
            currentContent.endText();
        }
    }

    private void drawWrappedText(String text, float x, float maxWidth) throws IOException {
        String[] words = sanitize(text).split(" ");
        StringBuilder line = new StringBuilder();

        for (String word : words) {
            String testLine = line.length() == 0 ? word : line + " " + word;
            if (testLine.length() * 5 > maxWidth && line.length() > 0) {
                checkPageSpace(LINE_HEIGHT);
                drawText(line.toString(), x, yPosition);
                yPosition -= 12;
                line = new StringBuilder(word);
            } else {
                line.append(line.length() == 0 ? "" : " ").append(word);
            }
        }

        if (line.length() > 0) {
            checkPageSpace(LINE_HEIGHT);
            drawText(line.toString(), x, yPosition);
            yPosition -= 12;
        }
    }

    /**
     * Стандартные шрифты кодируются WinAnsi: оставляем только печатный ASCII.
     */
    static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '\r' || c == '\n' || c == '\t') {
                sb.append(' ');
            } else if (c >= 0x20 && c < 0x7F) {
                sb.append(c);
            } else {
                sb.append('?');
            }
        }
        return sb.toString();
    }

    private static String millis(Double value) {
        return value != null ? " (" + value + "ms)" : "";
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.PDF;
    }
}
