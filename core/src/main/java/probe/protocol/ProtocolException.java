package probe.protocol;

import model.Protocol;

/**
 * Base exception for failures reported by a protocol client.
 * Every failure carries an {@link ErrorType} so that callers can match on the category
 * instead of on the concrete exception class of the underlying library.
 */
public class ProtocolException extends Exception {

    private final Protocol protocol;
    private final ErrorType errorType;

    public enum ErrorType {
        CONNECTION_FAILED,
        CONNECTION_TIMEOUT,
        HOST_RESOLUTION_FAILED,
        AUTHENTICATION_FAILED,
        PERMISSION_DENIED,
        NOT_SUPPORTED,
        NOT_FOUND,
        PROTOCOL_ERROR,
        UNKNOWN
    }

    public ProtocolException(Protocol protocol, ErrorType errorType, String message) {
        super(message);
        this.protocol = protocol;
        this.errorType = errorType != null ? errorType : ErrorType.UNKNOWN;
    }

    public ProtocolException(Protocol protocol, ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.protocol = protocol;
        this.errorType = errorType != null ? errorType : ErrorType.UNKNOWN;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", protocol, errorType, getMessage());
    }
}
