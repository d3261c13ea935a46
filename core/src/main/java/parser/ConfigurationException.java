package parser;

/**
 * Ошибка конфигурации запуска, обнаруженная до начала проверок
 * (нет хоста, неверный список портов, нечитаемый файл и т.п.).
 * Прерывает весь запуск.
 */
public class ConfigurationException extends Exception {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
