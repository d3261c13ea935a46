package cli;

import model.Protocol;
import parser.ConfigurationException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import probe.checker.CheckerRegistry;
import probe.protocol.ProtocolPluginLoader;
import probe.protocol.ProtocolRegistry;
import report.ReportFormat;
import util.FormatParser;
import util.StringUtils;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Точка входа CLI. Проверяет учетные данные FTP/SFTP в одном из трех режимов:
 * <ul>
 *   <li><b>single</b> - один сервер, {@code --host} с {@code --username}/{@code --password}</li>
 *   <li><b>bulk</b> - все серверы из экспорта FileZilla ({@code --filezilla-xml})</li>
 *   <li><b>brute-force</b> - перебор логинов, паролей и портов для одного хоста</li>
 * </ul>
 *
 * <p>Примеры использования:
 * <pre>
 * ftp-probe --host ftp.example.com --username user --password secret --check-path /pub
 * ftp-probe --filezilla-xml sitemanager.xml --json results.json
 * ftp-probe --host 10.0.0.5 --brute-force --user-list users.txt --pass-list pass.txt --port-list 21,2121
 * </pre>
 */
@Command(
    name = "ftp-probe",
    description = "Проверка учетных данных FTP/SFTP серверов: подключение, аутентификация и наличие пути",
    mixinStandardHelpOptions = true,
    version = "1.0-SNAPSHOT"
)
public class FtpProbeCli implements Callable<Integer> {
    private static final Logger logger = Logger.getLogger(FtpProbeCli.class.getName());

    @Option(names = {"--filezilla-xml"}, description = "FileZilla XML export with servers to check")
    private Path fileZillaXml;

    @Option(names = {"--host"}, description = "Single host to check")
    private String host;

    @Option(names = {"--brute-force"}, description = "Try every username/password/port combination against --host")
    private boolean bruteForce;

    @Option(names = {"--port"}, description = "Port (default: 21 for FTP, 22 for SFTP)")
    private Integer port;

    @Option(names = {"--username"}, description = "Username")
    private String username;

    @Option(names = {"--password"}, description = "Password")
    private String password;

    @Option(names = {"--protocol"}, description = "Protocol: 0 = FTP, 1 = SFTP (default: 0)", defaultValue = "0")
    private int protocolCode;

    @Option(names = {"--user-list"}, description = "File with usernames, one per line")
    private Path userList;

    @Option(names = {"--pass-list"}, description = "File with passwords, one per line")
    private Path passList;

    @Option(names = {"--combo-list"}, description = "File with user:password pairs, one per line")
    private Path comboList;

    @Option(names = {"--port-list"}, description = "File with ports or comma separated list (e.g. 21,2121)")
    private String portList;

    @Option(names = {"--timeout"}, description = "Per-stage timeout in seconds (default: 10)",
        defaultValue = "" + ProbeConfig.DEFAULT_TIMEOUT_SECONDS)
    private int timeout;

    @Option(names = {"--max-workers"}, description = "Concurrent checks (default: 5)",
        defaultValue = "" + ProbeConfig.DEFAULT_MAX_WORKERS)
    private int maxWorkers;

    @Option(names = {"--check-path"}, description = "Remote path to look for after login")
    private String checkPath;

    @Option(names = {"--txt"}, description = "Save text report to file")
    private Path txtOutput;

    @Option(names = {"--xml"}, description = "Save XML report to file")
    private Path xmlOutput;

    @Option(names = {"--json"}, description = "Save JSON report to file")
    private Path jsonOutput;

    @Option(names = {"--csv"}, description = "Save CSV report to file")
    private Path csvOutput;

    @Option(names = {"--pdf"}, description = "Save PDF report to file")
    private Path pdfOutput;

    @Option(names = {"-f", "--format"}, description = "Console report format: text, xml, json, csv (default: text)")
    private String format;

    @Option(names = {"-nc", "--no-color"}, description = "Disable colored output")
    private boolean noColor;

    @Option(names = {"-q", "--quiet"}, description = "Suppress progress and console report")
    private boolean quiet;

    @Option(names = {"--debug"}, description = "Verbose logging")
    private boolean debug;

    @Option(names = {"--plugins-dir"}, description = "Directory with protocol client plugins (default: plugins)",
        defaultValue = "plugins")
    private String pluginsDir;

    @Option(names = {"--progress-every"}, description = "Brute force progress line every N attempts (default: 10)",
        defaultValue = "" + ProbeConfig.DEFAULT_PROGRESS_EVERY)
    private int progressEvery;

    private final ProtocolRegistry registry;

    public FtpProbeCli() {
        this(ProtocolRegistry.getInstance());
    }

    FtpProbeCli(ProtocolRegistry registry) {
        this.registry = registry;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FtpProbeCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = new PrintWriter(System.out, true);
        LoggingSetup.configure(debug, quiet);

        try {
            ProbeConfig config = buildConfig();

            try (ProtocolPluginLoader pluginLoader = new ProtocolPluginLoader(pluginsDir)) {
                pluginLoader.discoverClientFactories(registry);
                CheckerRegistry checkers = CheckerRegistry.fromProtocolRegistry(registry);
                new ProbeRunner(config, checkers, out).run();
            }
            return 0;

        } catch (ConfigurationException e) {
            out.println("ERROR: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            out.println("ERROR: Interrupted");
            return 99;
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Unexpected error", e);
            out.println("ERROR: Unexpected error: " + e.getMessage());
            return 99;
        }
    }

    ProbeConfig buildConfig() throws ConfigurationException {
        ProbeConfig.Builder builder = ProbeConfig.builder();

        if (bruteForce) {
            builder.mode(ProbeMode.BRUTE_FORCE);
        } else if (fileZillaXml != null) {
            builder.mode(ProbeMode.BULK);
        } else if (StringUtils.isNotEmpty(host)) {
            builder.mode(ProbeMode.SINGLE);
        } else {
            throw new ConfigurationException("No mode selected: use --filezilla-xml, --host or --brute-force");
        }

        try {
            builder.protocol(Protocol.fromCode(protocolCode));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        ReportFormat consoleFormat;
        try {
            consoleFormat = FormatParser.parse(format);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        if (port != null && (port < 1 || port > 65535)) {
            throw new ConfigurationException("Port out of range: " + port);
        }

        return builder
            .host(host)
            .port(port)
            .username(username)
            .password(password)
            .userList(userList)
            .passList(passList)
            .comboList(comboList)
            .portList(StringUtils.cleanFileArgument(portList))
            .fileZillaXml(fileZillaXml)
            .timeoutSeconds(timeout)
            .maxWorkers(maxWorkers)
            .checkPath(checkPath)
            .output(ReportFormat.TEXT, txtOutput)
            .output(ReportFormat.XML, xmlOutput)
            .output(ReportFormat.JSON, jsonOutput)
            .output(ReportFormat.CSV, csvOutput)
            .output(ReportFormat.PDF, pdfOutput)
            .consoleFormat(consoleFormat)
            .useColors(!noColor)
            .quiet(quiet)
            .progressEvery(progressEvery)
            .build();
    }
}
