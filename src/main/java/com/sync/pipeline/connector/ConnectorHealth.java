package com.sync.pipeline.connector;

/**
 * Result of {@link Connector#checkHealth}.
 *
 * @param ok        whether the connector can fetch
 * @param message   failure reason, or a short status
 * @param retryable whether a failed check may pass later (e.g. a vendor outage rather than bad credentials)
 */
public record ConnectorHealth(boolean ok, String message, boolean retryable) {

    public static ConnectorHealth healthy() {
        return new ConnectorHealth(true, "OK", false);
    }

    public static ConnectorHealth unhealthy(String message) {
        return new ConnectorHealth(false, message, false);
    }

    public static ConnectorHealth unavailable(String message) {
        return new ConnectorHealth(false, message, true);
    }
}
