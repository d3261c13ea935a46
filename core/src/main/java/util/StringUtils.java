package util;

/**
 * Общие утилиты для работы со строками.
 */
public final class StringUtils {

    private StringUtils() {
        // Утилитный класс - запретить создание экземпляров
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Очищает путь к файлу из аргументов командной строки от окружающих кавычек и пробелов.
     *
     * @param location путь (может быть null)
     * @return очищенный путь или null если входная строка была null
     *
     * @example
     * <pre>
     * cleanFileArgument("  /tmp/ports.txt  ")      → "/tmp/ports.txt"
     * cleanFileArgument("\"C:/My Lists/ports.txt\"") → "C:/My Lists/ports.txt"
     * cleanFileArgument(null)                     → null
     * </pre>
     */
    public static String cleanFileArgument(String location) {
        if (location == null) {
            return null;
        }

        String cleaned = location.trim();
        if (cleaned.length() >= 2
                && (cleaned.startsWith("\"") && cleaned.endsWith("\"")
                    || cleaned.startsWith("'") && cleaned.endsWith("'"))) {
            cleaned = cleaned.substring(1, cleaned.length() - 1);
        }
        return cleaned.trim();
    }

    /**
     * @return true если строка null, пустая или содержит только пробелы
     */
    public static boolean isEmpty(String str) {
        return str == null || str.trim().isEmpty();
    }

    public static boolean isNotEmpty(String str) {
        return !isEmpty(str);
    }

    /**
     * Оставляет первые {@code maxLength} символов и добавляет "..." если строка длиннее.
     *
     * @param str исходная строка
     * @param maxLength число сохраняемых символов
     * @return строка не длиннее {@code maxLength + 3} или null
     */
    public static String abbreviate(String str, int maxLength) {
        if (str == null || str.length() <= maxLength) {
            return str;
        }
        return str.substring(0, maxLength) + "...";
    }

    /**
     * Форматирует время в миллисекундах для отчетов.
     *
     * @return строка вида "12.34" или пустая строка, если время не измерялось
     */
    public static String formatMillis(Double millis) {
        return millis != null ? String.valueOf(millis) : "";
    }
}
