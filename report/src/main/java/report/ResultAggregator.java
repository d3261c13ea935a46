package report;

import model.ProbeResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Накопитель результатов. Потокобезопасен: результаты могут добавляться
 * из нескольких потоков по мере завершения проверок.
 */
public final class ResultAggregator {
    private final List<ProbeResult> results = new ArrayList<>();

    public synchronized void add(ProbeResult result) {
        results.add(result);
    }

    public synchronized void addAll(Collection<ProbeResult> results) {
        this.results.addAll(results);
    }

    public synchronized int size() {
        return results.size();
    }

    /**
     * Снимок накопленных результатов. Последующие добавления на снимок не влияют.
     *
     * @param generatedAt время генерации отчета
     */
    public synchronized ProbeReport toReport(Instant generatedAt) {
        return new ProbeReport(new ArrayList<>(results), generatedAt);
    }

    public ProbeReport toReport() {
        return toReport(Instant.now());
    }
}
