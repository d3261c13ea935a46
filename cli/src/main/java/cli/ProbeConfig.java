package cli;

import model.Protocol;
import report.ReportFormat;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Неизменяемая конфигурация запуска, собранная из опций командной строки.
 */
public final class ProbeConfig {
    public static final int DEFAULT_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_MAX_WORKERS = 5;
    public static final int DEFAULT_PROGRESS_EVERY = 10;

    private final ProbeMode mode;
    private final String host;
    private final Integer port;
    private final Protocol protocol;
    private final String username;
    private final String password;
    private final Path userList;
    private final Path passList;
    private final Path comboList;
    private final String portList;
    private final Path fileZillaXml;
    private final int timeoutSeconds;
    private final int maxWorkers;
    private final String checkPath;
    private final Map<ReportFormat, Path> outputs;
    private final ReportFormat consoleFormat;
    private final boolean useColors;
    private final boolean quiet;
    private final int progressEvery;

    private ProbeConfig(Builder builder) {
        this.mode = builder.mode;
        this.host = builder.host;
        this.port = builder.port;
        this.protocol = builder.protocol != null ? builder.protocol : Protocol.FTP;
        this.username = builder.username;
        this.password = builder.password;
        this.userList = builder.userList;
        this.passList = builder.passList;
        this.comboList = builder.comboList;
        this.portList = builder.portList;
        this.fileZillaXml = builder.fileZillaXml;
        this.timeoutSeconds = builder.timeoutSeconds > 0 ? builder.timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
        this.maxWorkers = builder.maxWorkers > 0 ? builder.maxWorkers : DEFAULT_MAX_WORKERS;
        this.checkPath = builder.checkPath;
        this.outputs = Collections.unmodifiableMap(new EnumMap<>(builder.outputs));
        this.consoleFormat = builder.consoleFormat != null ? builder.consoleFormat : ReportFormat.TEXT;
        this.useColors = builder.useColors;
        this.quiet = builder.quiet;
        this.progressEvery = builder.progressEvery > 0 ? builder.progressEvery : DEFAULT_PROGRESS_EVERY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ProbeMode getMode() {
        return mode;
    }

    public String getHost() {
        return host;
    }

    /**
     * @return порт из {@code --port} или null
     */
    public Integer getPort() {
        return port;
    }

    /**
     * @return порт из {@code --port}, иначе порт протокола по умолчанию
     */
    public int getEffectivePort() {
        return port != null ? port : protocol.getDefaultPort();
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public Path getUserList() {
        return userList;
    }

    public Path getPassList() {
        return passList;
    }

    public Path getComboList() {
        return comboList;
    }

    public String getPortList() {
        return portList;
    }

    public Path getFileZillaXml() {
        return fileZillaXml;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public String getCheckPath() {
        return checkPath;
    }

    public Map<ReportFormat, Path> getOutputs() {
        return outputs;
    }

    public ReportFormat getConsoleFormat() {
        return consoleFormat;
    }

    public boolean isUseColors() {
        return useColors;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public int getProgressEvery() {
        return progressEvery;
    }

    public static class Builder {
        private ProbeMode mode;
        private String host;
        private Integer port;
        private Protocol protocol;
        private String username;
        private String password;
        private Path userList;
        private Path passList;
        private Path comboList;
        private String portList;
        private Path fileZillaXml;
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private String checkPath;
        private final Map<ReportFormat, Path> outputs = new EnumMap<>(ReportFormat.class);
        private ReportFormat consoleFormat;
        private boolean useColors = true;
        private boolean quiet;
        private int progressEvery = DEFAULT_PROGRESS_EVERY;

        public Builder mode(ProbeMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder userList(Path userList) {
            this.userList = userList;
            return this;
        }

        public Builder passList(Path passList) {
            this.passList = passList;
            return this;
        }

        public Builder comboList(Path comboList) {
            this.comboList = comboList;
            return this;
        }

        public Builder portList(String portList) {
            this.portList = portList;
            return this;
        }

        public Builder fileZillaXml(Path fileZillaXml) {
            this.fileZillaXml = fileZillaXml;
            return this;
        }

        public Builder timeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder checkPath(String checkPath) {
            this.checkPath = checkPath;
            return this;
        }

        public Builder output(ReportFormat format, Path file) {
            if (file != null) {
                this.outputs.put(format, file);
            }
            return this;
        }

        public Builder consoleFormat(ReportFormat consoleFormat) {
            this.consoleFormat = consoleFormat;
            return this;
        }

        public Builder useColors(boolean useColors) {
            this.useColors = useColors;
            return this;
        }

        public Builder quiet(boolean quiet) {
            this.quiet = quiet;
            return this;
        }

        public Builder progressEvery(int progressEvery) {
            this.progressEvery = progressEvery;
            return this;
        }

        public ProbeConfig build() {
            if (mode == null) {
                throw new IllegalStateException("mode is required");
            }
            return new ProbeConfig(this);
        }
    }
}
