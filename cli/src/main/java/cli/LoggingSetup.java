package cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Настройка java.util.logging для CLI.
 */
final class LoggingSetup {
    private static final String CONFIG_RESOURCE = "/logging.properties";

    private LoggingSetup() {
    }

    /**
     * Загружает logging.properties из classpath и выставляет уровень корневого логгера.
     *
     * @param debug {@code --debug}: FINE
     * @param quiet {@code --quiet}: только SEVERE
     */
    static void configure(boolean debug, boolean quiet) {
        try (InputStream config = LoggingSetup.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("Failed to read " + CONFIG_RESOURCE + ": " + e.getMessage());
        }

        Level level = levelFor(debug, quiet);
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }

    static Level levelFor(boolean debug, boolean quiet) {
        if (debug) {
            return Level.FINE;
        }
        return quiet ? Level.SEVERE : Level.WARNING;
    }
}
