package probe.protocol;

import model.Protocol;

/**
 * Base interface for the per-protocol client surfaces used by the checkers.
 *
 * <p>A client instance represents a single session: it is created by a
 * {@link ProtocolClientFactory}, used by exactly one probe and then closed.
 * Implementations are therefore not required to be thread-safe.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Obtain a fresh client from the factory</li>
 *   <li>Connect (and, depending on the protocol, authenticate)</li>
 *   <li>Inspect the server</li>
 *   <li>Call {@link #close()}, usually via try-with-resources</li>
 * </ol>
 */
public interface ProtocolClient extends AutoCloseable {

    /**
     * @return protocol served by this client
     */
    Protocol getProtocol();

    /**
     * @return true if the transport is currently open
     */
    boolean isConnected();

    /**
     * Close the session and release the transport.
     *
     * <p>Must be idempotent and must not throw: it runs on every exit path of a probe.
     */
    @Override
    void close();

    /**
     * Get a description of this client implementation, used for logging.
     */
    default String getDescription() {
        return String.format("%s Protocol Client", getProtocol());
    }
}
