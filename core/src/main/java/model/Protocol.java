package model;

/**
 * Протокол передачи файлов, по которому выполняется проверка.
 *
 * <p>Числовой код совпадает с кодировкой FileZilla: {@code 0} - FTP, {@code 1} - SFTP.
 */
public enum Protocol {
    FTP(0, 21),
    SFTP(1, 22);

    private final int code;
    private final int defaultPort;

    Protocol(int code, int defaultPort) {
        this.code = code;
        this.defaultPort = defaultPort;
    }

    public int getCode() {
        return code;
    }

    public int getDefaultPort() {
        return defaultPort;
    }

    /**
     * Возвращает протокол по числовому коду.
     *
     * @param code 0 для FTP, 1 для SFTP
     * @return соответствующий протокол
     * @throws IllegalArgumentException если код не поддерживается
     */
    public static Protocol fromCode(int code) {
        for (Protocol protocol : values()) {
            if (protocol.code == code) {
                return protocol;
            }
        }
        throw new IllegalArgumentException("Unsupported protocol code: " + code + " (expected 0 = FTP, 1 = SFTP)");
    }
}
