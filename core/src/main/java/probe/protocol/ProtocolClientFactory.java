package probe.protocol;

import model.Protocol;

/**
 * Service provider creating protocol clients.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/probe.protocol.ProtocolClientFactory}, either on the classpath
 * or inside {@code protocol-*.jar} plugin files (see {@link ProtocolPluginLoader}).
 *
 * @param <C> client surface produced by this factory
 */
public interface ProtocolClientFactory<C extends ProtocolClient> {

    /**
     * @return protocol served by the created clients
     */
    Protocol getProtocol();

    /**
     * Create a fresh, unconnected client. Called once per probe.
     */
    C createClient();

    /**
     * Get a description of the underlying implementation, used for logging.
     */
    default String getDescription() {
        return getClass().getSimpleName();
    }
}
