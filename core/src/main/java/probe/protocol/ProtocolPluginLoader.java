package probe.protocol;

import java.io.File;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Discovers {@link ProtocolClientFactory} implementations and registers them in a {@link ProtocolRegistry}.
 *
 * <p><b>Discovery:</b>
 * <ol>
 *   <li>Classpath factories found by {@link ServiceLoader}</li>
 *   <li>Factories inside {@code protocol-*.jar} files of the plugins directory,
 *       each JAR with its own {@link URLClassLoader}</li>
 * </ol>
 * Plugin factories are registered after classpath ones, so a plugin JAR overrides
 * the bundled client for the same protocol.
 *
 * <p><b>Plugin Structure:</b>
 * <pre>
 * plugins/
 * ├── protocol-ftp-1.0.jar
 * │   ├── META-INF/services/probe.protocol.ProtocolClientFactory
 * │   └── probe/protocol/ftp/CommonsNetFtpClientFactory.class
 * └── protocol-sftp-1.0.jar
 * </pre>
 */
public class ProtocolPluginLoader implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ProtocolPluginLoader.class.getName());
    private static final String PLUGIN_PREFIX = "protocol-";
    private static final String JAR_EXTENSION = ".jar";

    private final String pluginsDirectory;
    private final List<URLClassLoader> classLoaders;

    /**
     * @param pluginsDirectory path to plugins directory
     */
    public ProtocolPluginLoader(String pluginsDirectory) {
        this.pluginsDirectory = pluginsDirectory != null ? pluginsDirectory : "plugins";
        this.classLoaders = new ArrayList<>();
    }

    public ProtocolPluginLoader() {
        this("plugins");
    }

    /**
     * Discover all client factories and register them.
     *
     * @param registry registry to fill
     * @return discovered factories, classpath ones first
     */
    public List<ProtocolClientFactory<?>> discoverClientFactories(ProtocolRegistry registry) {
        List<ProtocolClientFactory<?>> allFactories = new ArrayList<>(loadClasspathFactories());
        logger.fine(String.format("Found %d classpath client factory(ies)", allFactories.size()));

        List<ProtocolClientFactory<?>> pluginFactories = loadPluginFactories();
        logger.fine(String.format("Found %d plugin client factory(ies) in %s", pluginFactories.size(), pluginsDirectory));
        allFactories.addAll(pluginFactories);

        for (ProtocolClientFactory<?> factory : allFactories) {
            try {
                registry.register(factory);
            } catch (IllegalArgumentException e) {
                logger.log(Level.WARNING,
                        String.format("Failed to register client factory: %s", factory.getClass().getName()), e);
            }
        }

        logger.info(String.format("Protocol clients available: %s", registry.getRegisteredProtocols()));
        return allFactories;
    }

    private List<ProtocolClientFactory<?>> loadClasspathFactories() {
        return load(ServiceLoader.load(ProtocolClientFactory.class, getClass().getClassLoader()), "classpath");
    }

    private List<ProtocolClientFactory<?>> loadPluginFactories() {
        List<ProtocolClientFactory<?>> factories = new ArrayList<>();

        File pluginsDir = new File(pluginsDirectory);
        if (!pluginsDir.isDirectory()) {
            logger.fine(String.format("Plugins directory does not exist or is not a directory: %s", pluginsDirectory));
            return factories;
        }

        File[] jarFiles = pluginsDir.listFiles((dir, name) ->
                name.startsWith(PLUGIN_PREFIX) && name.endsWith(JAR_EXTENSION));
        if (jarFiles == null || jarFiles.length == 0) {
            return factories;
        }
        Arrays.sort(jarFiles);

        for (File jarFile : jarFiles) {
            try {
                URLClassLoader classLoader = new URLClassLoader(
                        new URL[]{jarFile.toURI().toURL()},
                        getClass().getClassLoader());
                classLoaders.add(classLoader);

                List<ProtocolClientFactory<?>> found =
                        load(ServiceLoader.load(ProtocolClientFactory.class, classLoader), jarFile.getName());
                if (found.isEmpty()) {
                    logger.warning(String.format("No ProtocolClientFactory implementations found in %s", jarFile.getName()));
                }
                factories.addAll(found);
            } catch (Exception e) {
                logger.log(Level.WARNING,
                        String.format("Failed to load client factories from %s", jarFile.getName()), e);
            }
        }

        return factories;
    }

    private List<ProtocolClientFactory<?>> load(ServiceLoader<?> serviceLoader, String source) {
        List<ProtocolClientFactory<?>> factories = new ArrayList<>();
        try {
            for (Object service : serviceLoader) {
                ProtocolClientFactory<?> factory = (ProtocolClientFactory<?>) service;
                logger.fine(String.format("Discovered client factory: %s (%s) from %s",
                        factory.getProtocol(), factory.getClass().getName(), source));
                factories.add(factory);
            }
        } catch (ServiceConfigurationError e) {
            logger.log(Level.WARNING, "Error loading client factories from " + source, e);
        }
        return factories;
    }

    /**
     * Close all plugin class loaders.
     */
    @Override
    public void close() {
        for (URLClassLoader classLoader : classLoaders) {
            try {
                classLoader.close();
            } catch (Exception e) {
                logger.log(Level.WARNING, "Error closing class loader", e);
            }
        }
        classLoaders.clear();
    }

    public String getPluginsDirectory() {
        return pluginsDirectory;
    }

    public int getClassLoaderCount() {
        return classLoaders.size();
    }
}
