package report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import model.ProbeError;
import model.ProbeResult;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.*;

/**
 * Генератор отчетов в формате JSON: заголовок со сводкой и полные записи результатов,
 * включая найденные пароли, список возможностей и ошибки с их категориями.
 *
 * <p>Временные метки в ISO-8601, pretty-print с отступами.
 */
public final class JsonReporter implements Reporter {

    private final ObjectMapper objectMapper;

    public JsonReporter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void generate(ProbeReport report, PrintWriter writer) throws IOException {
        Map<String, Object> jsonReport = new LinkedHashMap<>();
        ReportSummary summary = report.getSummary();

        jsonReport.put("timestamp", report.getGeneratedAt());
        jsonReport.put("total_servers", summary.total());
        jsonReport.put("successful_connections", summary.successful());
        jsonReport.put("failed_connections", summary.failed());

        List<Map<String, Object>> servers = new ArrayList<>();
        for (ProbeResult result : report.getResults()) {
            servers.add(buildServer(result));
        }
        jsonReport.put("servers", servers);

        writer.println(objectMapper.writeValueAsString(jsonReport));
        writer.flush();
    }

    private Map<String, Object> buildServer(ProbeResult result) {
        Map<String, Object> server = new LinkedHashMap<>();
        server.put("host", result.getHost());
        server.put("port", result.getPort());
        server.put("username", result.getUsername());
        server.put("password", result.getPassword());
        server.put("protocol", result.getProtocol().name());
        server.put("timestamp", result.getTimestamp());
        server.put("connection", result.isConnection());
        server.put("connection_time", result.getConnectionTimeMs());
        server.put("authentication", result.isAuthentication());
        server.put("auth_time", result.getAuthTimeMs());
        server.put("check_path", result.getCheckPath());
        server.put("path_exists", result.getPathExists());
        server.put("path_type", result.getPathType() != null ? result.getPathType().getDisplayName() : null);
        server.put("path_check_time", result.getPathCheckTimeMs());
        server.put("welcome_message", result.getWelcomeMessage());
        server.put("features", result.getFeatures());
        server.put("errors", result.getErrors());

        List<Map<String, String>> details = new ArrayList<>();
        for (ProbeError error : result.getErrorDetails()) {
            Map<String, String> detail = new LinkedHashMap<>();
            detail.put("kind", error.kind().name());
            detail.put("message", error.message());
            details.add(detail);
        }
        server.put("error_details", details);
        server.put("total_time", result.getTotalTimeMs());
        return server;
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.JSON;
    }
}
