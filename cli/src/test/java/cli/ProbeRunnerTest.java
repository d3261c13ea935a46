package cli;

import model.Credential;
import model.Endpoint;
import model.ProbeDescriptor;
import model.ProbeResult;
import model.Protocol;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import parser.ConfigurationException;
import probe.checker.CheckerRegistry;
import probe.checker.ProtocolChecker;
import report.ProbeReport;
import report.ReportFormat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProbeRunnerTest {

    @TempDir
    Path tempDir;

    private final StringWriter buffer = new StringWriter();

    /**
     * Принимает только пару admin/letmein, запоминает все попытки.
     */
    private static final class FakeChecker implements ProtocolChecker {
        private final Protocol protocol;
        final List<ProbeDescriptor> seen = Collections.synchronizedList(new ArrayList<>());

        FakeChecker(Protocol protocol) {
            this.protocol = protocol;
        }

        @Override
        public Protocol getProtocol() {
            return protocol;
        }

        @Override
        public ProbeResult check(Endpoint endpoint, Credential credential, int timeoutSeconds, String checkPath) {
            ProbeDescriptor descriptor = new ProbeDescriptor(endpoint, credential, checkPath);
            seen.add(descriptor);
            boolean ok = credential.username().equals("admin") && credential.password().equals("letmein");
            return ProbeResult.builder(descriptor).connection(true).authentication(ok).build();
        }
    }

    private ProbeRunner runner(ProbeConfig config, ProtocolChecker... checkers) {
        return new ProbeRunner(config, new CheckerRegistry(List.of(checkers)), new PrintWriter(buffer));
    }

    @Test
    void testSingleModeWritesReports() throws Exception {
        FakeChecker ftp = new FakeChecker(Protocol.FTP);
        Path json = tempDir.resolve("out.json");
        Path csv = tempDir.resolve("out.csv");
        ProbeConfig config = ProbeConfig.builder()
            .mode(ProbeMode.SINGLE)
            .host("ftp.example.com")
            .username("admin")
            .password("letmein")
            .output(ReportFormat.JSON, json)
            .output(ReportFormat.CSV, csv)
            .useColors(false)
            .build();

        ProbeReport report = runner(config, ftp).run();

        assertEquals(1, report.getSummary().successful());
        assertEquals(21, ftp.seen.get(0).endpoint().port());
        assertTrue(Files.readString(json).contains("\"total_servers\" : 1"));
        assertTrue(Files.readString(csv).startsWith("Host,"));
        String output = buffer.toString();
        assertTrue(output.contains("JSON report saved to " + json));
        assertTrue(output.contains("CSV report saved to " + csv));
        assertFalse(output.contains("Advanced FTP/SFTP Check Results"));
    }

    @Test
    void testConsoleReportWithoutOutputFiles() throws Exception {
        ProbeConfig config = ProbeConfig.builder()
            .mode(ProbeMode.SINGLE)
            .host("h")
            .username("u")
            .password("")
            .useColors(false)
            .build();

        runner(config, new FakeChecker(Protocol.FTP)).run();

        String output = buffer.toString();
        assertTrue(output.contains("Checking 1 server(s)..."));
        assertTrue(output.contains("Advanced FTP/SFTP Check Results"));
    }

    @Test
    void testQuietModePrintsNothing() throws Exception {
        ProbeConfig config = ProbeConfig.builder()
            .mode(ProbeMode.SINGLE)
            .host("h")
            .username("u")
            .password("p")
            .quiet(true)
            .build();

        runner(config, new FakeChecker(Protocol.FTP)).run();

        assertEquals("", buffer.toString());
    }

    @Test
    void testSingleModeRequiresCredentials() {
        ProbeConfig config = ProbeConfig.builder().mode(ProbeMode.SINGLE).host("h").username("u").build();

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> runner(config, new FakeChecker(Protocol.FTP)).run());
        assertTrue(e.getMessage().contains("--password"));
    }

    @Test
    void testBruteForceDefaults() throws Exception {
        FakeChecker ftp = new FakeChecker(Protocol.FTP);
        ProbeConfig config = ProbeConfig.builder()
            .mode(ProbeMode.BRUTE_FORCE)
            .host("10.0.0.5")
            .quiet(true)
            .build();

        ProbeReport report = runner(config, ftp).run();

        int expected = ProbeRunner.DEFAULT_USERNAMES.size() * ProbeRunner.DEFAULT_PASSWORDS.size();
        assertEquals(expected, report.getResults().size());
        assertEquals(expected, ftp.seen.size());
        assertTrue(ftp.seen.stream().anyMatch(d -> d.credential().password().isEmpty()));
    }

    @Test
    void testBruteForceWithListsAndPorts() throws Exception {
        Path users = Files.writeString(tempDir.resolve("users.txt"), "root\nadmin\n");
        Path passwords = Files.writeString(tempDir.resolve("pass.txt"), "# top\nletmein\ntoor\n");
        FakeChecker ftp = new FakeChecker(Protocol.FTP);
        ProbeConfig config = ProbeConfig.builder()
            .mode(ProbeMode.BRUTE_FORCE)
            .host("10.0.0.5")
            .userList(users)
            .passList(passwords)
            .portList("21,2121")
            .useColors(false)
            .build();

        ProbeReport report = runner(config, ftp).run();

        assertEquals(8, report.getResults().size());
        assertEquals(2, report.getSummary().successful());
        String output = buffer.toString();
        assertTrue(output.contains("Starting brute force with 8 combinations..."));
        assertTrue(output.contains("✓ FOUND: admin:letmein@10.0.0.5:21"));
        assertTrue(output.contains("✓ FOUND: admin:letmein@10.0.0.5:2121"));
    }

    @Test
    void testComboListOverridesUserAndPasswordLists() throws Exception {
        Path combos = Files.writeString(tempDir.resolve("combos.txt"), "admin:letmein\nguest:guest\nbroken\n");
        FakeChecker sftp = new FakeChecker(Protocol.SFTP);
        ProbeConfig config = ProbeConfig.builder()
            .mode(ProbeMode.BRUTE_FORCE)
            .host("10.0.0.5")
            .protocol(Protocol.SFTP)
            .username("ignored")
            .comboList(combos)
            .quiet(true)
            .build();

        ProbeReport report = runner(config, sftp).run();

        assertEquals(2, report.getResults().size());
        assertTrue(sftp.seen.stream().allMatch(d -> d.endpoint().port() == 22));
    }

    @Test
    void testBruteForceRequiresHost() {
        ProbeConfig config = ProbeConfig.builder().mode(ProbeMode.BRUTE_FORCE).build();

        assertThrows(ConfigurationException.class, () -> runner(config, new FakeChecker(Protocol.FTP)).run());
    }

    @Test
    void testBulkModeFromFileZilla() throws Exception {
        Path xml = Files.writeString(tempDir.resolve("sites.xml"), """
            <FileZilla3><Servers>
              <Server><Host>a.example.com</Host><User>admin</User><Pass>letmein</Pass></Server>
              <Server><Host>b.example.com</Host><Port>2121</Port><User>bob</User><Pass>x</Pass></Server>
            </Servers></FileZilla3>
            """);
        FakeChecker ftp = new FakeChecker(Protocol.FTP);
        ProbeConfig config = ProbeConfig.builder()
            .mode(ProbeMode.BULK)
            .fileZillaXml(xml)
            .checkPath("/pub")
            .quiet(true)
            .build();

        ProbeReport report = runner(config, ftp).run();

        assertEquals(2, report.getResults().size());
        assertEquals(1, report.getSummary().successful());
        assertTrue(ftp.seen.stream().allMatch(d -> "/pub".equals(d.checkPath())));
    }

    @Test
    void testMissingProtocolClientIsConfigurationError() throws Exception {
        Path xml = Files.writeString(tempDir.resolve("sites.xml"),
            "<FileZilla3><Servers><Server><Host>s</Host><Protocol>1</Protocol></Server></Servers></FileZilla3>");
        ProbeConfig config = ProbeConfig.builder().mode(ProbeMode.BULK).fileZillaXml(xml).build();

        ConfigurationException e = assertThrows(ConfigurationException.class,
            () -> runner(config, new FakeChecker(Protocol.FTP)).run());
        assertTrue(e.getMessage().contains("SFTP"));
    }

    @Test
    void testPdfOnConsoleRequiresFile() {
        ProbeConfig config = ProbeConfig.builder()
            .mode(ProbeMode.SINGLE)
            .host("h").username("u").password("p")
            .consoleFormat(ReportFormat.PDF)
            .build();

        assertThrows(ConfigurationException.class, () -> runner(config, new FakeChecker(Protocol.FTP)).run());
    }

    @Test
    void testPdfFileOutput() throws Exception {
        Path pdf = tempDir.resolve("out.pdf");
        ProbeConfig config = ProbeConfig.builder()
            .mode(ProbeMode.SINGLE)
            .host("h").username("u").password("p")
            .output(ReportFormat.PDF, pdf)
            .quiet(true)
            .build();

        runner(config, new FakeChecker(Protocol.FTP)).run();

        byte[] bytes = Files.readAllBytes(pdf);
        assertEquals("%PDF", new String(bytes, 0, 4, StandardCharsets.US_ASCII));
    }
}
