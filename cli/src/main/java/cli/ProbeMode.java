package cli;

/**
 * Режим запуска, выбирается по опциям командной строки.
 */
public enum ProbeMode {
    /** Один сервер с одной парой учетных данных ({@code --host --username --password}) */
    SINGLE,

    /** Все серверы из экспорта FileZilla ({@code --filezilla-xml}) */
    BULK,

    /** Перебор учетных данных и портов для одного хоста ({@code --brute-force --host}) */
    BRUTE_FORCE
}
