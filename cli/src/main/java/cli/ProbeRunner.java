package cli;

import model.Credential;
import model.Endpoint;
import model.ProbeDescriptor;
import model.ProbeResult;
import model.Protocol;
import parser.ConfigurationException;
import parser.FileZillaConfigParser;
import parser.PortListParser;
import parser.ServerEntry;
import parser.WordlistLoader;
import probe.BruteForceSpec;
import probe.CombinationGenerator;
import probe.ProbeProgressListener;
import probe.ProbeScheduler;
import probe.checker.CheckerRegistry;
import report.PdfReporter;
import report.ProbeReport;
import report.ReportFormat;
import report.Reporter;
import report.ReporterFactory;
import report.ResultAggregator;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;

/**
 * Выполняет запуск по {@link ProbeConfig}: готовит дескрипторы для выбранного режима,
 * запускает проверки и сохраняет отчеты.
 *
 * <p>Все ошибки конфигурации обнаруживаются до запуска первой проверки.
 */
public final class ProbeRunner {
    private static final Logger logger = Logger.getLogger(ProbeRunner.class.getName());

    static final List<String> DEFAULT_USERNAMES = List.of("anonymous", "ftp", "admin", "root", "guest");
    static final List<String> DEFAULT_PASSWORDS =
        List.of("anonymous", "ftp", "admin", "root", "guest", "123456", "password", "");

    private final ProbeConfig config;
    private final CheckerRegistry checkers;
    private final PrintWriter out;

    public ProbeRunner(ProbeConfig config, CheckerRegistry checkers, PrintWriter out) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.checkers = Objects.requireNonNull(checkers, "checkers cannot be null");
        this.out = Objects.requireNonNull(out, "out cannot be null");
    }

    /**
     * Дескрипторы и их количество, известное до запуска.
     */
    record ProbePlan(Iterable<ProbeDescriptor> descriptors, long total, Set<Protocol> protocols) {
    }

    /**
     * Выполняет запуск целиком.
     *
     * @return снимок результатов, по которому построены отчеты
     * @throws ConfigurationException если конфигурация невыполнима
     * @throws IOException если не удалось записать отчет
     * @throws InterruptedException если поток прерван во время проверок
     */
    public ProbeReport run() throws ConfigurationException, IOException, InterruptedException {
        if (config.getConsoleFormat() == ReportFormat.PDF && !config.isQuiet() && config.getOutputs().isEmpty()) {
            throw new ConfigurationException("PDF output requires a file, use --pdf <file>");
        }

        ProbePlan plan = plan();
        requireCheckers(plan.protocols());

        ProbeProgressListener listener = config.isQuiet()
            ? ProbeProgressListener.noOp()
            : new ConsoleProgressListener(out, config.isUseColors(),
                config.getMode() == ProbeMode.BRUTE_FORCE, config.getProgressEvery());

        ProbeScheduler scheduler = new ProbeScheduler(checkers, config.getMaxWorkers());
        List<ProbeResult> results = scheduler.run(plan.descriptors(), plan.total(), config.getTimeoutSeconds(), listener);

        ResultAggregator aggregator = new ResultAggregator();
        aggregator.addAll(results);
        ProbeReport report = aggregator.toReport();

        writeReports(report);
        return report;
    }

    ProbePlan plan() throws ConfigurationException {
        return switch (config.getMode()) {
            case BRUTE_FORCE -> planBruteForce();
            case BULK -> planBulk();
            case SINGLE -> planSingle();
        };
    }

    private ProbePlan planBruteForce() throws ConfigurationException {
        if (config.getHost() == null || config.getHost().isBlank()) {
            throw new ConfigurationException("--host is required in brute-force mode");
        }

        BruteForceSpec.Builder spec = BruteForceSpec.builder()
            .host(config.getHost())
            .protocol(config.getProtocol())
            .checkPath(config.getCheckPath());

        if (config.getComboList() != null) {
            spec.combos(WordlistLoader.loadCombos(config.getComboList()));
        } else {
            spec.usernames(config.getUserList() != null
                ? WordlistLoader.load(config.getUserList())
                : config.getUsername() != null ? List.of(config.getUsername()) : DEFAULT_USERNAMES);
            spec.passwords(config.getPassList() != null
                ? WordlistLoader.load(config.getPassList())
                : config.getPassword() != null ? List.of(config.getPassword()) : DEFAULT_PASSWORDS);
        }

        spec.ports(config.getPortList() != null
            ? PortListParser.parse(config.getPortList())
            : List.of(config.getEffectivePort()));

        CombinationGenerator generator = new CombinationGenerator(spec.build());
        logger.info("Brute force against " + config.getHost() + ": " + generator.totalAttempts() + " combination(s)");
        return new ProbePlan(generator, generator.totalAttempts(), EnumSet.of(config.getProtocol()));
    }

    private ProbePlan planBulk() throws ConfigurationException {
        List<ServerEntry> servers = new FileZillaConfigParser().parse(config.getFileZillaXml());
        List<ProbeDescriptor> descriptors = new ArrayList<>();
        Set<Protocol> protocols = EnumSet.noneOf(Protocol.class);
        for (ServerEntry server : servers) {
            descriptors.add(server.toDescriptor(config.getCheckPath()));
            protocols.add(server.protocol());
        }
        logger.info("Loaded " + descriptors.size() + " server(s) from " + config.getFileZillaXml());
        return new ProbePlan(descriptors, descriptors.size(), protocols);
    }

    private ProbePlan planSingle() throws ConfigurationException {
        if (config.getUsername() == null || config.getPassword() == null) {
            throw new ConfigurationException("--username and --password are required with --host (non-brute mode)");
        }
        Endpoint endpoint;
        try {
            endpoint = new Endpoint(config.getHost(), config.getEffectivePort(), config.getProtocol());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        ProbeDescriptor descriptor = new ProbeDescriptor(endpoint,
            new Credential(config.getUsername(), config.getPassword()), config.getCheckPath());
        return new ProbePlan(List.of(descriptor), 1, EnumSet.of(config.getProtocol()));
    }

    private void requireCheckers(Set<Protocol> protocols) throws ConfigurationException {
        for (Protocol protocol : protocols) {
            if (!checkers.supports(protocol)) {
                throw new ConfigurationException("No client available for protocol " + protocol
                    + " (check the plugins directory)");
            }
        }
    }

    private void writeReports(ProbeReport report) throws IOException {
        for (Map.Entry<ReportFormat, Path> output : config.getOutputs().entrySet()) {
            writeReport(report, output.getKey(), output.getValue());
            if (!config.isQuiet()) {
                out.println(output.getKey().getFileExtension().toUpperCase(Locale.ROOT)
                    + " report saved to " + output.getValue());
            }
        }

        if (config.getOutputs().isEmpty() && !config.isQuiet()) {
            Reporter reporter = ReporterFactory.createReporter(config.getConsoleFormat(), config.isUseColors());
            reporter.generate(report, out);
        }
        out.flush();
    }

    static void writeReport(ProbeReport report, ReportFormat format, Path file) throws IOException {
        if (format.isBinary()) {
            try (OutputStream stream = Files.newOutputStream(file)) {
                new PdfReporter().generateToOutputStream(report, stream);
            }
            return;
        }
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            ReporterFactory.createReporter(format).generate(report, writer);
        }
    }
}
