package report;

import model.ProbeResult;
import util.StringUtils;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Текстовый отчет. В консоли может выводиться с ANSI цветами.
 *
 * <p>Приветствие сервера обрезается до 100 символов, возможности сервера
 * выводятся только количеством.
 */
public final class TextReporter implements Reporter {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";

    static final int WELCOME_MAX_LENGTH = 100;

    private final boolean useColors;

    public TextReporter(boolean useColors) {
        this.useColors = useColors;
    }

    public TextReporter() {
        this(false);
    }

    @Override
    public void generate(ProbeReport report, PrintWriter writer) throws IOException {
        ReportSummary summary = report.getSummary();

        writer.println(colorize("Advanced FTP/SFTP Check Results", ANSI_BOLD));
        writer.println("==============================");
        writer.println("Generated: " + report.getGeneratedAt());
        writer.println("Total servers: " + summary.total());
        writer.println();
        writer.println("Successful connections: " + colorize(String.valueOf(summary.successful()), ANSI_GREEN));
        writer.println("Failed connections: " + colorize(String.valueOf(summary.failed()), ANSI_RED));
        writer.println();

        int index = 1;
        for (ProbeResult result : report.getResults()) {
            printResult(writer, index++, result);
        }
        writer.flush();
    }

    private void printResult(PrintWriter writer, int index, ProbeResult result) {
        writer.println(colorize("Server " + index + ": " + result.getUsername() + "@" + result.getHost()
            + ":" + result.getPort() + " (" + result.getProtocol() + ")", ANSI_CYAN));
        writer.println("  Password: " + result.getPassword());
        writer.println("  Timestamp: " + result.getTimestamp());

        writer.println("  Connection: " + status(result.isConnection()) + millis(result.getConnectionTimeMs()));
        writer.println("  Authentication: " + status(result.isAuthentication()) + millis(result.getAuthTimeMs()));

        if (result.isPathChecked()) {
            StringBuilder line = new StringBuilder("  Path check: ")
                .append(Boolean.TRUE.equals(result.getPathExists()) ? "Exists" : "Missing")
                .append(millis(result.getPathCheckTimeMs()));
            if (result.getPathType() != null) {
                line.append(" [Type: ").append(result.getPathType().getDisplayName()).append("]");
            }
            writer.println(line);
        }

        if (StringUtils.isNotEmpty(result.getWelcomeMessage())) {
            writer.println("  Welcome: " + StringUtils.abbreviate(result.getWelcomeMessage(), WELCOME_MAX_LENGTH));
        }

        if (!result.getFeatures().isEmpty()) {
            writer.println("  Features: " + result.getFeatures().size() + " supported");
        }

        writer.println("  Total time: "
            + (result.getTotalTimeMs() != null ? result.getTotalTimeMs() : "N/A") + "ms");

        if (result.hasErrors()) {
            writer.println("  Errors:");
            for (String error : result.getErrors()) {
                writer.println("    - " + colorize(error, ANSI_YELLOW));
            }
        }
        writer.println();
    }

    private String status(boolean ok) {
        return ok ? colorize("Success", ANSI_GREEN) : colorize("Failed", ANSI_RED);
    }

    private static String millis(Double value) {
        return value != null ? " (" + value + "ms)" : "";
    }

    private String colorize(String text, String colorCode) {
        if (!useColors) {
            return text;
        }
        return colorCode + text + ANSI_RESET;
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.TEXT;
    }
}
