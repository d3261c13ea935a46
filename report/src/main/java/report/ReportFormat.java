package report;

/**
 * Поддерживаемые форматы отчетов.
 */
public enum ReportFormat {
    /** Текстовый отчет, также выводится в консоль */
    TEXT("Plain text report", "txt"),

    /** XML с корнем {@code ftp_check_results} */
    XML("XML report", "xml"),

    /** JSON: заголовок и полные записи результатов */
    JSON("JSON format", "json"),

    /** CSV с фиксированным набором колонок */
    CSV("CSV table", "csv"),

    /**
     * PDF отчет со сводкой и блоком на каждый результат.
     * Требует бинарного вывода, см. {@link PdfReporter#generateToOutputStream}.
     */
    PDF("PDF report", "pdf");

    private final String description;
    private final String fileExtension;

    ReportFormat(String description, String fileExtension) {
        this.description = description;
        this.fileExtension = fileExtension;
    }

    public String getDescription() {
        return description;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public boolean isBinary() {
        return this == PDF;
    }
}
