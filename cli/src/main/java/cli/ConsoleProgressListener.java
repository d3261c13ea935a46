package cli;

import model.ProbeDescriptor;
import model.ProbeResult;
import probe.ProbeEvent;
import probe.ProbeProgressListener;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * Консольный вывод прогресса проверок.
 *
 * <p>В режиме перебора выводятся только найденные пары и строка прогресса
 * на каждое N-е завершение. В остальных режимах выводится каждый результат с ошибками.
 */
public final class ConsoleProgressListener implements ProbeProgressListener {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_CYAN = "\u001B[36m";

    private final PrintWriter out;
    private final boolean useColors;
    private final boolean bruteForce;
    private final int progressEvery;

    public ConsoleProgressListener(PrintWriter out, boolean useColors, boolean bruteForce, int progressEvery) {
        this.out = out;
        this.useColors = useColors;
        this.bruteForce = bruteForce;
        this.progressEvery = Math.max(1, progressEvery);
    }

    @Override
    public void onRunStart(long totalAttempts) {
        if (bruteForce) {
            out.println(colorize("Starting brute force with " + totalAttempts + " combinations...", ANSI_YELLOW));
        } else {
            out.println(colorize("Checking " + totalAttempts + " server(s)...", ANSI_YELLOW));
        }
        out.flush();
    }

    @Override
    public void onProbeComplete(ProbeEvent event) {
        if (bruteForce) {
            printBruteForceProgress(event);
        } else {
            printResult(event.descriptor(), event.result());
        }
        out.flush();
    }

    private void printBruteForceProgress(ProbeEvent event) {
        ProbeResult result = event.result();
        if (result.isSuccessful()) {
            out.println(colorize(String.format(Locale.ROOT, "✓ FOUND: %s:%s@%s:%d (%.1f%% complete)",
                result.getUsername(), result.getPassword(), result.getHost(), result.getPort(),
                event.percentComplete()), ANSI_GREEN));
        } else if (event.completed() % progressEvery == 0) {
            out.println(colorize(String.format(Locale.ROOT, "Progress: %.1f%% (%d/%d)",
                event.percentComplete(), event.completed(), event.total()), ANSI_YELLOW));
        }
    }

    private void printResult(ProbeDescriptor descriptor, ProbeResult result) {
        if (result.isSuccessful()) {
            out.println(colorize(String.format("✓ SUCCESS: %s:%s@%s:%d (%s) - Connection: %sms, Auth: %sms",
                result.getUsername(), result.getPassword(), result.getHost(), result.getPort(),
                result.getProtocol(), orNa(result.getConnectionTimeMs()), orNa(result.getAuthTimeMs())), ANSI_GREEN));
        } else {
            out.println(colorize("✗ FAILED: " + descriptor, ANSI_RED));
        }
        for (String error : result.getErrors()) {
            out.println(colorize("  Error: " + error, ANSI_YELLOW));
        }
    }

    @Override
    public void onRunComplete(long successful, long durationSeconds) {
        out.println(colorize("Completed in " + durationSeconds + "s, " + successful + " successful", ANSI_CYAN));
        out.flush();
    }

    private static String orNa(Double millis) {
        return millis != null ? String.valueOf(millis) : "N/A";
    }

    private String colorize(String text, String colorCode) {
        if (!useColors) {
            return text;
        }
        return colorCode + text + ANSI_RESET;
    }
}
