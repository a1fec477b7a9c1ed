package com.schematrack.host;

/**
 * Thrown when a decorator cannot be installed on an {@link ExtensionPoint}: the point is frozen or
 * another owner holds an exclusive claim on it.
 */
public class ExtensionPointUnavailableException extends RuntimeException {

    private final String extensionPoint;
    private final String owner;

    public ExtensionPointUnavailableException(String extensionPoint, String owner, String reason) {
        super("Extension point '%s' is unavailable to '%s': %s"
                .formatted(extensionPoint, owner, reason));
        this.extensionPoint = extensionPoint;
        this.owner = owner;
    }

    public String extensionPoint() {
        return extensionPoint;
    }

    public String owner() {
        return owner;
    }
}
