package parser;

import model.Credential;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Загрузка словарей для перебора.
 *
 * <p>Формат файлов словарей:
 * <ul>
 *   <li>Простой текстовый файл в UTF-8: одно значение на строку</li>
 *   <li>Некорректные байты пропускаются</li>
 *   <li>Пустые строки игнорируются</li>
 *   <li>Строки начинающиеся с # - комментарии</li>
 * </ul>
 */
public final class WordlistLoader {
    private static final Logger logger = Logger.getLogger(WordlistLoader.class.getName());

    private WordlistLoader() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param file файл словаря
     * @return строки словаря без пробелов по краям, в исходном порядке
     * @throws ConfigurationException если файл не удалось прочитать
     */
    public static List<String> load(Path file) throws ConfigurationException {
        List<String> words = new ArrayList<>();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim();
                if (!word.isEmpty() && !line.startsWith("#")) {
                    words.add(word);
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("Error reading wordlist " + file + ": " + e.getMessage(), e);
        }

        logger.fine("Loaded " + words.size() + " entries from " + file);
        return words;
    }

    /**
     * Загружает пары {@code user:password}. Строка делится по первому двоеточию,
     * строки без двоеточия пропускаются.
     */
    public static List<Credential> loadCombos(Path file) throws ConfigurationException {
        List<Credential> combos = new ArrayList<>();
        for (String line : load(file)) {
            Credential combo = parseCombo(line);
            if (combo != null) {
                combos.add(combo);
            }
        }
        return combos;
    }

    static Credential parseCombo(String line) {
        int colon = line.indexOf(':');
        if (colon < 0) {
            return null;
        }
        return new Credential(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
    }
}
