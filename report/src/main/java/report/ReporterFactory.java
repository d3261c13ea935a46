package report;

/**
 * Фабрика для создания экземпляров генераторов отчетов.
 *
 * <pre>{@code
 * Reporter console = ReporterFactory.createReporter(ReportFormat.TEXT, true);
 * Reporter csv = ReporterFactory.createReporter(ReportFormat.CSV);
 * }</pre>
 */
public final class ReporterFactory {

    private ReporterFactory() {
        // Утилитный класс - конструктор закрыт
    }

    /**
     * Создает генератор отчетов для указанного формата.
     *
     * <p>Параметр {@code useColors} применяется только для {@link ReportFormat#TEXT}.
     *
     * @param format формат отчета
     * @param useColors использовать ли ANSI цвета
     * @return генератор отчетов
     * @throws NullPointerException если {@code format} равен null
     */
    public static Reporter createReporter(ReportFormat format, boolean useColors) {
        return switch (format) {
            case TEXT -> new TextReporter(useColors);
            case XML -> new XmlReporter();
            case JSON -> new JsonReporter();
            case CSV -> new CsvReporter();
            case PDF -> new PdfReporter();
        };
    }

    /**
     * Генератор без цветов, для записи в файлы.
     */
    public static Reporter createReporter(ReportFormat format) {
        return createReporter(format, false);
    }
}
