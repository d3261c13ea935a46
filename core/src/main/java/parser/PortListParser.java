package parser;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Разбор {@code --port-list}: путь к файлу с портами либо список через запятую.
 * Нечисловые элементы списка через запятую пропускаются.
 */
public final class PortListParser {

    private PortListParser() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param value путь к файлу или строка вида {@code "21,2121,990"}
     * @return порты в исходном порядке
     * @throws ConfigurationException если порт вне диапазона 1-65535, строка файла не число
     *         или в результате не осталось ни одного порта
     */
    public static List<Integer> parse(String value) throws ConfigurationException {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Port list is empty");
        }

        List<Integer> ports = new ArrayList<>();
        Path file = Path.of(value);
        if (Files.isRegularFile(file)) {
            for (String line : WordlistLoader.load(file)) {
                if (!isDigits(line)) {
                    throw new ConfigurationException("Invalid port '" + line + "' in " + value);
                }
                ports.add(toPort(line));
            }
        } else {
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (isDigits(trimmed)) {
                    ports.add(toPort(trimmed));
                }
            }
        }

        if (ports.isEmpty()) {
            throw new ConfigurationException("No valid ports in '" + value + "'");
        }
        return ports;
    }

    private static int toPort(String digits) throws ConfigurationException {
        int port;
        try {
            port = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Port out of range: " + digits, e);
        }
        if (port < 1 || port > 65535) {
            throw new ConfigurationException("Port out of range: " + port);
        }
        return port;
    }

    private static boolean isDigits(String s) {
        return !s.isEmpty() && s.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}
