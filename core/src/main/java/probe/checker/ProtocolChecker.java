package probe.checker;

import model.Credential;
import model.Endpoint;
import model.ProbeDescriptor;
import model.ProbeResult;
import model.Protocol;

/**
 * Performs one end-to-end probe (connect, authenticate, optional inspection) against a single
 * endpoint with a single credential.
 *
 * <p>Implementations never throw past this boundary: every failure is captured in the
 * returned {@link ProbeResult} as error entries and boolean flags.
 */
public interface ProtocolChecker {

    /**
     * @return protocol handled by this checker
     */
    Protocol getProtocol();

    /**
     * Probe an endpoint.
     *
     * @param endpoint target
     * @param credential credential to try
     * @param timeoutSeconds connect timeout, also bounding the later stages
     * @param checkPath remote path whose existence should be verified, or null
     * @return the probe outcome
     */
    ProbeResult check(Endpoint endpoint, Credential credential, int timeoutSeconds, String checkPath);

    default ProbeResult check(ProbeDescriptor descriptor, int timeoutSeconds) {
        return check(descriptor.endpoint(), descriptor.credential(), timeoutSeconds, descriptor.checkPath());
    }
}
