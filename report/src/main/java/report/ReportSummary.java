package report;

import model.ProbeResult;

import java.util.Collection;

/**
 * Сводка по результатам: всего, успешных ({@code connection && authentication}), неуспешных.
 * Единственное место, где считается успешность, для всех форматов отчетов.
 */
public record ReportSummary(int total, int successful, int failed) {

    public static ReportSummary of(Collection<ProbeResult> results) {
        int successful = (int) results.stream().filter(ProbeResult::isSuccessful).count();
        return new ReportSummary(results.size(), successful, results.size() - successful);
    }
}
