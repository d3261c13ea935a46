package model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Нормализованный результат одной попытки подключения к одной цели с одной парой учетных данных.
 *
 * <p>Формируется чекером через {@link Builder} по мере прохождения этапов проверки
 * (подключение, аутентификация, возможности сервера, проверка пути) и после
 * {@link Builder#build()} становится неизменяемым.
 *
 * <p>Инварианты, проверяемые при построении:
 * <ul>
 *   <li>{@code authentication == true} влечет {@code connection == true}</li>
 *   <li>{@code pathExists != null} только если путь был запрошен в дескрипторе</li>
 * </ul>
 *
 * <p>Пароль сохраняется намеренно: успешный результат перебора должен сообщать найденный пароль.
 * Временные значения - миллисекунды с точностью до двух знаков, {@code null} если этап не измерялся.
 */
public final class ProbeResult {
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final Protocol protocol;
    private final Instant timestamp;
    private final String checkPath;
    private final boolean connection;
    private final Double connectionTimeMs;
    private final boolean authentication;
    private final Double authTimeMs;
    private final Boolean pathExists;
    private final PathType pathType;
    private final Double pathCheckTimeMs;
    private final String welcomeMessage;
    private final List<String> features;
    private final List<ProbeError> errors;
    private final Double totalTimeMs;

    private ProbeResult(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.username = builder.username;
        this.password = builder.password;
        this.protocol = builder.protocol;
        this.timestamp = builder.timestamp;
        this.checkPath = builder.checkPath;
        this.connection = builder.connection;
        this.connectionTimeMs = builder.connectionTimeMs;
        this.authentication = builder.authentication;
        this.authTimeMs = builder.authTimeMs;
        this.pathExists = builder.pathExists;
        this.pathType = builder.pathType;
        this.pathCheckTimeMs = builder.pathCheckTimeMs;
        this.welcomeMessage = builder.welcomeMessage;
        this.features = Collections.unmodifiableList(new ArrayList<>(builder.features));
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
        this.totalTimeMs = builder.totalTimeMs;
    }

    /**
     * Начинает результат для дескриптора. Время начала фиксируется в момент вызова.
     *
     * @param descriptor дескриптор проверки
     * @return новый построитель
     */
    public static Builder builder(ProbeDescriptor descriptor) {
        return new Builder(descriptor);
    }

    /**
     * Создает результат-заглушку для проверки, завершившейся непредвиденным исключением.
     *
     * @param descriptor дескриптор проверки
     * @param message описание ошибки
     * @return результат с {@code connection=false}, {@code authentication=false} и одной ошибкой
     */
    public static ProbeResult failure(ProbeDescriptor descriptor, String message) {
        return builder(descriptor)
            .addError(ErrorKind.UNEXPECTED_ERROR, message)
            .build();
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getCheckPath() {
        return checkPath;
    }

    public boolean isConnection() {
        return connection;
    }

    public Double getConnectionTimeMs() {
        return connectionTimeMs;
    }

    public boolean isAuthentication() {
        return authentication;
    }

    public Double getAuthTimeMs() {
        return authTimeMs;
    }

    /**
     * @return {@code true}/{@code false} если путь проверялся, {@code null} если проверка не запрашивалась
     */
    public Boolean getPathExists() {
        return pathExists;
    }

    public boolean isPathChecked() {
        return pathExists != null;
    }

    public PathType getPathType() {
        return pathType;
    }

    public Double getPathCheckTimeMs() {
        return pathCheckTimeMs;
    }

    public String getWelcomeMessage() {
        return welcomeMessage;
    }

    public List<String> getFeatures() {
        return features;
    }

    /**
     * @return сообщения об ошибках в порядке их возникновения
     */
    public List<String> getErrors() {
        return errors.stream().map(ProbeError::message).toList();
    }

    public List<ProbeError> getErrorDetails() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Double getTotalTimeMs() {
        return totalTimeMs;
    }

    /**
     * Успешной считается проверка, в которой удалось и подключиться, и аутентифицироваться.
     */
    public boolean isSuccessful() {
        return connection && authentication;
    }

    @Override
    public String toString() {
        return "ProbeResult{" +
               username + "@" + host + ":" + port +
               ", protocol=" + protocol +
               ", connection=" + connection +
               ", authentication=" + authentication +
               ", pathExists=" + pathExists +
               ", errors=" + errors.size() +
               '}';
    }

    /**
     * Построитель результата. Используется одним потоком - тем, который выполняет проверку.
     */
    public static final class Builder {
        private final String host;
        private final int port;
        private final String username;
        private final String password;
        private final Protocol protocol;
        private final String checkPath;
        private Instant timestamp;
        private boolean connection;
        private Double connectionTimeMs;
        private boolean authentication;
        private Double authTimeMs;
        private Boolean pathExists;
        private PathType pathType;
        private Double pathCheckTimeMs;
        private String welcomeMessage;
        private final List<String> features = new ArrayList<>();
        private final List<ProbeError> errors = new ArrayList<>();
        private Double totalTimeMs;

        private Builder(ProbeDescriptor descriptor) {
            Objects.requireNonNull(descriptor, "descriptor cannot be null");
            this.host = descriptor.endpoint().host();
            this.port = descriptor.endpoint().port();
            this.protocol = descriptor.endpoint().protocol();
            this.username = descriptor.credential().username();
            this.password = descriptor.credential().password();
            this.checkPath = descriptor.checkPath();
            this.timestamp = Instant.now();
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp);
            return this;
        }

        public Builder connection(boolean connection) {
            this.connection = connection;
            return this;
        }

        public Builder connectionTimeMs(Double connectionTimeMs) {
            this.connectionTimeMs = connectionTimeMs;
            return this;
        }

        public Builder authentication(boolean authentication) {
            this.authentication = authentication;
            return this;
        }

        public Builder authTimeMs(Double authTimeMs) {
            this.authTimeMs = authTimeMs;
            return this;
        }

        public Builder pathExists(Boolean pathExists) {
            this.pathExists = pathExists;
            return this;
        }

        public Builder pathType(PathType pathType) {
            this.pathType = pathType;
            return this;
        }

        public Builder pathCheckTimeMs(Double pathCheckTimeMs) {
            this.pathCheckTimeMs = pathCheckTimeMs;
            return this;
        }

        public Builder welcomeMessage(String welcomeMessage) {
            this.welcomeMessage = welcomeMessage;
            return this;
        }

        public Builder features(List<String> features) {
            this.features.clear();
            this.features.addAll(features);
            return this;
        }

        public Builder addError(ErrorKind kind, String message) {
            this.errors.add(new ProbeError(kind, message));
            return this;
        }

        public Builder totalTimeMs(Double totalTimeMs) {
            this.totalTimeMs = totalTimeMs;
            return this;
        }

        public boolean isConnection() {
            return connection;
        }

        public boolean isAuthentication() {
            return authentication;
        }

        public ProbeResult build() {
            if (authentication && !connection) {
                throw new IllegalStateException("authentication=true requires connection=true");
            }
            if (pathExists != null && checkPath == null) {
                throw new IllegalStateException("pathExists set although no check path was requested");
            }
            return new ProbeResult(this);
        }
    }
}
