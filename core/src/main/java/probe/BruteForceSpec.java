package probe;

import model.Credential;
import model.Protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Описание пространства перебора: один хост, список портов и либо независимые списки
 * имен пользователей и паролей, либо готовые пары (combo-list).
 *
 * <p>Если заданы пары, списки пользователей и паролей игнорируются.
 */
public final class BruteForceSpec {
    private final String host;
    private final Protocol protocol;
    private final List<Integer> ports;
    private final List<String> usernames;
    private final List<String> passwords;
    private final List<Credential> combos;
    private final String checkPath;

    private BruteForceSpec(Builder builder) {
        if (builder.host == null || builder.host.isBlank()) {
            throw new IllegalArgumentException("Host is required for brute force");
        }
        this.host = builder.host;
        this.protocol = builder.protocol != null ? builder.protocol : Protocol.FTP;
        this.ports = builder.ports.isEmpty()
            ? List.of(this.protocol.getDefaultPort())
            : Collections.unmodifiableList(new ArrayList<>(builder.ports));
        this.usernames = Collections.unmodifiableList(new ArrayList<>(builder.usernames));
        this.passwords = Collections.unmodifiableList(new ArrayList<>(builder.passwords));
        this.combos = Collections.unmodifiableList(new ArrayList<>(builder.combos));
        this.checkPath = builder.checkPath;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getHost() {
        return host;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public List<Integer> getPorts() {
        return ports;
    }

    public List<String> getUsernames() {
        return usernames;
    }

    public List<String> getPasswords() {
        return passwords;
    }

    public List<Credential> getCombos() {
        return combos;
    }

    public String getCheckPath() {
        return checkPath;
    }

    public boolean isComboMode() {
        return !combos.isEmpty();
    }

    /**
     * Общее число попыток, известное до запуска проверок.
     */
    public long totalAttempts() {
        long perPort = isComboMode()
            ? combos.size()
            : (long) usernames.size() * passwords.size();
        return ports.size() * perPort;
    }

    public static class Builder {
        private String host;
        private Protocol protocol;
        private final List<Integer> ports = new ArrayList<>();
        private final List<String> usernames = new ArrayList<>();
        private final List<String> passwords = new ArrayList<>();
        private final List<Credential> combos = new ArrayList<>();
        private String checkPath;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder ports(List<Integer> ports) {
            this.ports.addAll(Objects.requireNonNull(ports));
            return this;
        }

        public Builder usernames(List<String> usernames) {
            this.usernames.addAll(Objects.requireNonNull(usernames));
            return this;
        }

        public Builder passwords(List<String> passwords) {
            this.passwords.addAll(Objects.requireNonNull(passwords));
            return this;
        }

        public Builder combos(List<Credential> combos) {
            this.combos.addAll(Objects.requireNonNull(combos));
            return this;
        }

        public Builder checkPath(String checkPath) {
            this.checkPath = checkPath;
            return this;
        }

        public BruteForceSpec build() {
            return new BruteForceSpec(this);
        }
    }
}
