package report;

import model.ProbeResult;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Неизменяемый снимок результатов для генерации отчетов.
 *
 * <p>Сводка вычисляется один раз при создании и используется всеми генераторами,
 * поэтому отчеты разных форматов всегда согласованы.
 */
public final class ProbeReport {
    private final List<ProbeResult> results;
    private final Instant generatedAt;
    private final ReportSummary summary;

    public ProbeReport(List<ProbeResult> results, Instant generatedAt) {
        this.results = List.copyOf(Objects.requireNonNull(results, "results cannot be null"));
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt cannot be null");
        this.summary = ReportSummary.of(this.results);
    }

    public List<ProbeResult> getResults() {
        return results;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public ReportSummary getSummary() {
        return summary;
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
