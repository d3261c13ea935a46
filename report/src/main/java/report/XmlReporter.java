package report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import model.ProbeResult;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;

/**
 * XML отчет с корнем {@code ftp_check_results}.
 *
 * <pre>
 * &lt;ftp_check_results&gt;
 *   &lt;timestamp/&gt; &lt;total_servers/&gt; &lt;successful_connections/&gt; &lt;failed_connections/&gt;
 *   &lt;servers&gt;
 *     &lt;server&gt;
 *       &lt;host/&gt; ... &lt;status/&gt; &lt;path_check/&gt; &lt;features/&gt; &lt;errors/&gt;
 *     &lt;/server&gt;
 *   &lt;/servers&gt;
 * &lt;/ftp_check_results&gt;
 * </pre>
 *
 * Необязательные элементы без значения не выводятся. В {@code @JsonPropertyOrder} списки
 * указываются по имени элемента ({@code server}, {@code feature}, {@code error}), а не обертки.
 */
public final class XmlReporter implements Reporter {

    private final XmlMapper xmlMapper;

    public XmlReporter() {
        this.xmlMapper = new XmlMapper();
        this.xmlMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.xmlMapper.enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION);
    }

    @Override
    public void generate(ProbeReport report, PrintWriter writer) throws IOException {
        ReportSummary summary = report.getSummary();
        XmlResults document = new XmlResults(
            report.getGeneratedAt().toString(),
            summary.total(),
            summary.successful(),
            summary.failed(),
            report.getResults().stream().map(XmlReporter::toServer).toList());

        writer.println(xmlMapper.writeValueAsString(document));
        writer.flush();
    }

    private static XmlServer toServer(ProbeResult result) {
        XmlStatus status = new XmlStatus(
            result.isConnection(), result.getConnectionTimeMs(),
            result.isAuthentication(), result.getAuthTimeMs());

        XmlPathCheck pathCheck = result.isPathChecked()
            ? new XmlPathCheck(
                result.getPathExists(),
                result.getPathType() != null ? result.getPathType().getDisplayName() : null,
                result.getPathCheckTimeMs())
            : null;

        return new XmlServer(
            result.getHost(),
            result.getPort(),
            result.getUsername(),
            result.getPassword(),
            result.getProtocol().name(),
            result.getTimestamp().toString(),
            status,
            pathCheck,
            result.getWelcomeMessage(),
            result.getFeatures().isEmpty() ? null : result.getFeatures(),
            result.getTotalTimeMs(),
            result.hasErrors() ? result.getErrors() : null);
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.XML;
    }

    @JacksonXmlRootElement(localName = "ftp_check_results")
    @JsonPropertyOrder({"timestamp", "total_servers", "successful_connections", "failed_connections", "server"})
    static final class XmlResults {
        @JsonProperty("timestamp")
        public final String timestamp;
        @JsonProperty("total_servers")
        public final int totalServers;
        @JsonProperty("successful_connections")
        public final int successfulConnections;
        @JsonProperty("failed_connections")
        public final int failedConnections;
        @JacksonXmlElementWrapper(localName = "servers")
        @JacksonXmlProperty(localName = "server")
        public final List<XmlServer> servers;

        XmlResults(String timestamp, int totalServers, int successfulConnections, int failedConnections,
                   List<XmlServer> servers) {
            this.timestamp = timestamp;
            this.totalServers = totalServers;
            this.successfulConnections = successfulConnections;
            this.failedConnections = failedConnections;
            this.servers = servers;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"host", "port", "username", "password", "protocol", "timestamp", "status", "path_check",
        "welcome_message", "feature", "total_time_ms", "error"})
    static final class XmlServer {
        @JsonProperty("host")
        public final String host;
        @JsonProperty("port")
        public final int port;
        @JsonProperty("username")
        public final String username;
        @JsonProperty("password")
        public final String password;
        @JsonProperty("protocol")
        public final String protocol;
        @JsonProperty("timestamp")
        public final String timestamp;
        @JsonProperty("status")
        public final XmlStatus status;
        @JsonProperty("path_check")
        public final XmlPathCheck pathCheck;
        @JsonProperty("welcome_message")
        public final String welcomeMessage;
        @JacksonXmlElementWrapper(localName = "features")
        @JacksonXmlProperty(localName = "feature")
        public final List<String> features;
        @JsonProperty("total_time_ms")
        public final Double totalTimeMs;
        @JacksonXmlElementWrapper(localName = "errors")
        @JacksonXmlProperty(localName = "error")
        public final List<String> errors;

        XmlServer(String host, int port, String username, String password, String protocol, String timestamp,
                  XmlStatus status, XmlPathCheck pathCheck, String welcomeMessage,
                  List<String> features, Double totalTimeMs, List<String> errors) {
            this.host = host;
            this.port = port;
            this.username = username;
            this.password = password;
            this.protocol = protocol;
            this.timestamp = timestamp;
            this.status = status;
            this.pathCheck = pathCheck;
            this.welcomeMessage = welcomeMessage;
            this.features = features;
            this.totalTimeMs = totalTimeMs;
            this.errors = errors;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"connection", "connection_time_ms", "authentication", "authentication_time_ms"})
    static final class XmlStatus {
        @JsonProperty("connection")
        public final boolean connection;
        @JsonProperty("connection_time_ms")
        public final Double connectionTimeMs;
        @JsonProperty("authentication")
        public final boolean authentication;
        @JsonProperty("authentication_time_ms")
        public final Double authTimeMs;

        XmlStatus(boolean connection, Double connectionTimeMs, boolean authentication, Double authTimeMs) {
            this.connection = connection;
            this.connectionTimeMs = connectionTimeMs;
            this.authentication = authentication;
            this.authTimeMs = authTimeMs;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"exists", "type", "check_time_ms"})
    static final class XmlPathCheck {
        @JsonProperty("exists")
        public final Boolean exists;
        @JsonProperty("type")
        public final String type;
        @JsonProperty("check_time_ms")
        public final Double checkTimeMs;

        XmlPathCheck(Boolean exists, String type, Double checkTimeMs) {
            this.exists = exists;
            this.type = type;
            this.checkTimeMs = checkTimeMs;
        }
    }
}
