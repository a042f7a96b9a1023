package com.sync.pipeline.connector;

/**
 * Failure reported by a {@link Connector}.
 * Configuration and authentication failures are never retryable.
 */
public class ConnectorException extends RuntimeException {

    public enum Kind { CONFIGURATION, AUTHENTICATION, TRANSIENT }

    private final Kind kind;
    private final boolean retryable;

    public ConnectorException(String message) {
        this(Kind.TRANSIENT, message, null);
    }

    public ConnectorException(String message, Throwable cause) {
        this(Kind.TRANSIENT, message, cause);
    }

    public ConnectorException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = kind == Kind.TRANSIENT;
    }

    public static ConnectorException configuration(String message) {
        return new ConnectorException(Kind.CONFIGURATION, message, null);
    }

    public static ConnectorException authentication(String message) {
        return new ConnectorException(Kind.AUTHENTICATION, message, null);
    }

    public static ConnectorException transientFailure(String message, Throwable cause) {
        return new ConnectorException(Kind.TRANSIENT, message, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
