package util;

import report.ReportFormat;

/**
 * Утилита для парсинга формата отчета из строкового представления.
 *
 * <p>Поддерживаемые значения (без учета регистра):
 * <ul>
 *   <li><b>text, txt, console</b> - текстовый отчет</li>
 *   <li><b>xml</b></li>
 *   <li><b>json</b></li>
 *   <li><b>csv</b></li>
 *   <li><b>pdf</b></li>
 * </ul>
 */
public final class FormatParser {

    private FormatParser() {
        // Утилитный класс - запретить создание экземпляров
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Null и пустая строка трактуются как "text".
     *
     * @param format строковое представление формата
     * @return соответствующий {@link ReportFormat}
     * @throws IllegalArgumentException если формат не распознан
     *
     * @example
     * <pre>
     * FormatParser.parse("txt")  → TEXT
     * FormatParser.parse("JSON") → JSON
     * FormatParser.parse(null)   → TEXT
     * FormatParser.parse("html") → IllegalArgumentException
     * </pre>
     */
    public static ReportFormat parse(String format) {
        if (format == null || format.trim().isEmpty()) {
            return ReportFormat.TEXT;
        }

        return switch (format.trim().toLowerCase()) {
            case "text", "txt", "console" -> ReportFormat.TEXT;
            case "xml" -> ReportFormat.XML;
            case "json" -> ReportFormat.JSON;
            case "csv" -> ReportFormat.CSV;
            case "pdf" -> ReportFormat.PDF;
            default -> throw new IllegalArgumentException(
                String.format("Unknown report format: '%s'. Valid values: text, xml, json, csv, pdf", format));
        };
    }
}
