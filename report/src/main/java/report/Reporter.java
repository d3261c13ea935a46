package report;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Интерфейс для генерации отчетов о результатах проверок в различных форматах.
 *
 * <p>Генерация является чистой функцией от {@link ProbeReport}: отчет не изменяется,
 * и один и тот же снимок можно отрисовать во все форматы.
 *
 * <p>Пример использования:
 * <pre>{@code
 * ProbeReport report = aggregator.toReport();
 * Reporter reporter = ReporterFactory.createReporter(ReportFormat.TEXT);
 * try (PrintWriter writer = new PrintWriter(System.out)) {
 *     reporter.generate(report, writer);
 * }
 * }</pre>
 *
 * @see ReporterFactory
 */
public interface Reporter {

    /**
     * Генерирует отчет.
     *
     * @param report снимок результатов
     * @param writer поток вывода для записи отчета
     * @throws IOException если возникла ошибка при записи отчета
     */
    void generate(ProbeReport report, PrintWriter writer) throws IOException;

    /**
     * Возвращает формат отчета, поддерживаемый данным генератором.
     */
    ReportFormat getFormat();
}
