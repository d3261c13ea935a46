package probe.checker;

import model.Credential;
import model.Endpoint;
import model.ErrorKind;
import model.ProbeDescriptor;
import model.ProbeResult;
import probe.protocol.ProtocolClient;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Base checker: opens a fresh client, runs the protocol stages and finalizes the result.
 *
 * <p>Finalization always happens: the client is closed on every exit path and
 * {@code totalTimeMs} is measured from the start of the connect stage.
 * Runtime failures escaping the stages are captured as {@link ErrorKind#UNEXPECTED_ERROR}.
 *
 * @param <C> client surface used by the concrete checker
 */
public abstract class AbstractProtocolChecker<C extends ProtocolClient> implements ProtocolChecker {
    protected final Logger logger = Logger.getLogger(getClass().getName());

    private final Supplier<? extends C> clientSupplier;

    protected AbstractProtocolChecker(Supplier<? extends C> clientSupplier) {
        this.clientSupplier = Objects.requireNonNull(clientSupplier, "clientSupplier cannot be null");
    }

    @Override
    public final ProbeResult check(Endpoint endpoint, Credential credential, int timeoutSeconds, String checkPath) {
        ProbeDescriptor descriptor = new ProbeDescriptor(endpoint, credential, checkPath);
        ProbeResult.Builder result = ProbeResult.builder(descriptor);
        int timeoutMs = timeoutMillis(timeoutSeconds);

        try (StageTimer ignored = StageTimer.start(result::totalTimeMs)) {
            try (C client = clientSupplier.get()) {
                performChecks(client, descriptor, timeoutMs, result);
            } catch (RuntimeException e) {
                logger.fine("Unexpected failure probing " + descriptor + ": " + e);
                result.addError(ErrorKind.UNEXPECTED_ERROR, "Unexpected error: " + describe(e));
            }
        }

        return result.build();
    }

    /**
     * Таймаут в миллисекундах для сокетов: не меньше секунды, не больше {@link Integer#MAX_VALUE}.
     */
    static int timeoutMillis(int timeoutSeconds) {
        return (int) Math.min(Integer.MAX_VALUE, TimeUnit.SECONDS.toMillis(Math.max(1, timeoutSeconds)));
    }

    /**
     * Run the protocol stages. Each stage that fails records its error in {@code result}
     * and returns, skipping the remaining stages of this probe.
     *
     * @param client fresh, unconnected client; closed by the caller
     * @param descriptor what to probe
     * @param timeoutMs per-stage timeout in milliseconds
     * @param result result under construction
     */
    protected abstract void performChecks(C client, ProbeDescriptor descriptor, int timeoutMs,
                                          ProbeResult.Builder result);

    /**
     * @return message of the throwable, or its class name when it has none
     */
    protected static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null && !message.isBlank() ? message : e.getClass().getSimpleName();
    }
}
