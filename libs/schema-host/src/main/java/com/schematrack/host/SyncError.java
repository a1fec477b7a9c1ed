package com.schematrack.host;

/**
 * A non-fatal failure reported on a {@link ReconcilePass}'s error channel.
 *
 * @param source who reported the failure (the host itself, or an installed extension)
 * @param entityName logical name of the affected entity, or null when the failure concerns the
 *     whole pass
 * @param cause the underlying exception
 */
public record SyncError(String source, String entityName, Throwable cause) {

    /** Source value used for failures raised by the host's own synchronizers. */
    public static final String HOST_SOURCE = "host";

    public SyncError {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source must not be null or blank");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause must not be null");
        }
    }

    /**
     * Returns the cause's message, or its class name when it carries none.
     */
    public String message() {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getName();
    }
}
