package cli;

import model.Protocol;
import org.junit.jupiter.api.Test;
import parser.ConfigurationException;
import picocli.CommandLine;
import probe.protocol.ProtocolRegistry;
import report.ReportFormat;

import java.nio.file.Path;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

class FtpProbeCliTest {

    private static FtpProbeCli parse(String... args) {
        FtpProbeCli cli = new FtpProbeCli(new ProtocolRegistry());
        new CommandLine(cli).parseArgs(args);
        return cli;
    }

    private static int execute(String... args) {
        return new CommandLine(new FtpProbeCli(new ProtocolRegistry())).execute(args);
    }

    @Test
    void testModeSelection() throws Exception {
        assertEquals(ProbeMode.SINGLE, parse("--host", "h").buildConfig().getMode());
        assertEquals(ProbeMode.BULK, parse("--filezilla-xml", "sites.xml", "--host", "h").buildConfig().getMode());
        assertEquals(ProbeMode.BRUTE_FORCE,
            parse("--brute-force", "--filezilla-xml", "sites.xml", "--host", "h").buildConfig().getMode());
    }

    @Test
    void testOptionsAreFoldedIntoConfig() throws Exception {
        ProbeConfig config = parse(
            "--host", "h", "--protocol", "1", "--timeout", "3", "--max-workers", "8",
            "--json", "r.json", "--pdf", "r.pdf", "-f", "csv", "--no-color", "--port-list", " '21,22' ")
            .buildConfig();

        assertEquals(Protocol.SFTP, config.getProtocol());
        assertEquals(22, config.getEffectivePort());
        assertEquals(3, config.getTimeoutSeconds());
        assertEquals(8, config.getMaxWorkers());
        assertEquals(Path.of("r.json"), config.getOutputs().get(ReportFormat.JSON));
        assertEquals(Path.of("r.pdf"), config.getOutputs().get(ReportFormat.PDF));
        assertEquals(2, config.getOutputs().size());
        assertEquals(ReportFormat.CSV, config.getConsoleFormat());
        assertFalse(config.isUseColors());
        assertEquals("21,22", config.getPortList());
    }

    @Test
    void testDefaults() throws Exception {
        ProbeConfig config = parse("--host", "h").buildConfig();

        assertEquals(Protocol.FTP, config.getProtocol());
        assertEquals(21, config.getEffectivePort());
        assertEquals(10, config.getTimeoutSeconds());
        assertEquals(5, config.getMaxWorkers());
        assertEquals(10, config.getProgressEvery());
        assertEquals(ReportFormat.TEXT, config.getConsoleFormat());
        assertTrue(config.getOutputs().isEmpty());
    }

    @Test
    void testInvalidOptions() {
        assertThrows(ConfigurationException.class, () -> parse().buildConfig());
        assertThrows(ConfigurationException.class, () -> parse("--host", "h", "--protocol", "3").buildConfig());
        assertThrows(ConfigurationException.class, () -> parse("--host", "h", "-f", "html").buildConfig());
        assertThrows(ConfigurationException.class, () -> parse("--host", "h", "--port", "70000").buildConfig());
    }

    @Test
    void testConfigurationErrorsExitWithOne() {
        assertEquals(1, execute());
        assertEquals(1, execute("--host", "h", "--username", "u"));
        assertEquals(1, execute("--brute-force", "--port-list", "ftp"));
        assertEquals(1, execute("--filezilla-xml", "does-not-exist.xml", "--plugins-dir", "target/no-plugins"));
    }

    @Test
    void testLogLevels() {
        assertEquals(Level.FINE, LoggingSetup.levelFor(true, true));
        assertEquals(Level.SEVERE, LoggingSetup.levelFor(false, true));
        assertEquals(Level.WARNING, LoggingSetup.levelFor(false, false));
    }
}
