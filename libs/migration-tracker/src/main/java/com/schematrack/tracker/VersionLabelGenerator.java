package com.schematrack.tracker;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Formats synchronization instants into ledger version labels.
 * <p>
 * The default pattern has second precision: two synchronizations starting within the same second
 * produce the same label, and the ledger rejects the second one.
 */
public final class VersionLabelGenerator {

    /** Default label pattern, e.g. {@code 20240101120000}. */
    public static final String DEFAULT_PATTERN = "yyyyMMddHHmmss";

    /** Default zone the label is rendered in. */
    public static final ZoneId DEFAULT_ZONE = ZoneOffset.UTC;

    private final String pattern;
    private final DateTimeFormatter formatter;

    /**
     * Creates a generator with the default pattern and zone.
     */
    public VersionLabelGenerator() {
        this(DEFAULT_PATTERN, DEFAULT_ZONE);
    }

    /**
     * Creates a generator.
     *
     * @param pattern {@link DateTimeFormatter} pattern
     * @param zone zone the instant is rendered in
     * @throws IllegalArgumentException if the pattern is invalid
     */
    public VersionLabelGenerator(String pattern, ZoneId zone) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must not be null or blank");
        }
        if (zone == null) {
            throw new IllegalArgumentException("zone must not be null");
        }
        this.pattern = pattern;
        this.formatter = DateTimeFormatter.ofPattern(pattern).withZone(zone);
        try {
            formatter.format(Instant.EPOCH);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("pattern '" + pattern + "' cannot format an instant", e);
        }
    }

    /**
     * Returns the label for the given instant.
     */
    public String labelFor(Instant instant) {
        return formatter.format(instant);
    }

    public String pattern() {
        return pattern;
    }

    public ZoneId zone() {
        return formatter.getZone();
    }
}
