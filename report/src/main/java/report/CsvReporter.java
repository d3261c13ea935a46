package report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import model.ProbeResult;
import util.StringUtils;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

/**
 * CSV отчет: одна строка на результат, ошибки склеены через "; ",
 * наличие пути как Yes/No/N/A, возможности сервера только количеством.
 */
public final class CsvReporter implements Reporter {

    static final String ERROR_SEPARATOR = "; ";

    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public CsvReporter() {
        this.csvMapper = new CsvMapper();
        this.schema = csvMapper.schemaFor(CsvRow.class).withHeader();
    }

    @Override
    public void generate(ProbeReport report, PrintWriter writer) throws IOException {
        List<CsvRow> rows = report.getResults().stream().map(CsvReporter::toRow).toList();
        writer.print(csvMapper.writer(schema).writeValueAsString(rows));
        writer.flush();
    }

    private static CsvRow toRow(ProbeResult result) {
        String pathExists = result.getPathExists() == null ? "N/A" : result.getPathExists() ? "Yes" : "No";
        return new CsvRow(
            result.getHost(),
            String.valueOf(result.getPort()),
            result.getUsername(),
            result.getPassword(),
            result.getProtocol().name(),
            result.getTimestamp().toString(),
            result.isConnection() ? "Success" : "Failed",
            StringUtils.formatMillis(result.getConnectionTimeMs()),
            result.isAuthentication() ? "Success" : "Failed",
            StringUtils.formatMillis(result.getAuthTimeMs()),
            result.getCheckPath() != null ? result.getCheckPath() : "",
            pathExists,
            result.getPathType() != null ? result.getPathType().getDisplayName() : "",
            StringUtils.formatMillis(result.getPathCheckTimeMs()),
            StringUtils.formatMillis(result.getTotalTimeMs()),
            result.getWelcomeMessage() != null ? result.getWelcomeMessage() : "",
            String.valueOf(result.getFeatures().size()),
            String.join(ERROR_SEPARATOR, result.getErrors()));
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.CSV;
    }

    @JsonPropertyOrder({"Host", "Port", "Username", "Password", "Protocol", "Timestamp", "Connection",
        "Connection Time (ms)", "Authentication", "Auth Time (ms)", "Check Path", "Path Exists", "Path Type",
        "Path Check Time (ms)", "Total Time (ms)", "Welcome Message", "Features", "Errors"})
    record CsvRow(
        @JsonProperty("Host") String host,
        @JsonProperty("Port") String port,
        @JsonProperty("Username") String username,
        @JsonProperty("Password") String password,
        @JsonProperty("Protocol") String protocol,
        @JsonProperty("Timestamp") String timestamp,
        @JsonProperty("Connection") String connection,
        @JsonProperty("Connection Time (ms)") String connectionTime,
        @JsonProperty("Authentication") String authentication,
        @JsonProperty("Auth Time (ms)") String authTime,
        @JsonProperty("Check Path") String checkPath,
        @JsonProperty("Path Exists") String pathExists,
        @JsonProperty("Path Type") String pathType,
        @JsonProperty("Path Check Time (ms)") String pathCheckTime,
        @JsonProperty("Total Time (ms)") String totalTime,
        @JsonProperty("Welcome Message") String welcomeMessage,
        @JsonProperty("Features") String features,
        @JsonProperty("Errors") String errors) {
    }
}
