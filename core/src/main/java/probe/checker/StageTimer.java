package probe.checker;

import java.util.function.Consumer;

/**
 * Scoped stopwatch that records the elapsed time exactly once when closed,
 * so that a stage's duration is recorded on every exit path.
 *
 * <pre>{@code
 * try (StageTimer timer = StageTimer.start(result::pathCheckTimeMs)) {
 *     checkPath(client, path, result);
 * }
 * }</pre>
 */
public final class StageTimer implements AutoCloseable {

    private final long startNanos;
    private final Consumer<Double> sink;
    private boolean recorded;

    private StageTimer(Consumer<Double> sink) {
        this.startNanos = System.nanoTime();
        this.sink = sink;
    }

    public static StageTimer start(Consumer<Double> sink) {
        return new StageTimer(sink);
    }

    /**
     * @return milliseconds since the timer started, rounded to two decimals
     */
    public double elapsedMs() {
        return millisSince(startNanos);
    }

    @Override
    public void close() {
        if (!recorded) {
            recorded = true;
            sink.accept(elapsedMs());
        }
    }

    /**
     * @param startNanos value of {@link System#nanoTime()} at the start of the measurement
     * @return elapsed milliseconds rounded to two decimals
     */
    public static double millisSince(long startNanos) {
        return Math.round((System.nanoTime() - startNanos) / 10_000.0) / 100.0;
    }
}
