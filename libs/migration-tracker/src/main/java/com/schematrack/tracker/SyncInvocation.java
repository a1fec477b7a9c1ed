package com.schematrack.tracker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.MDC;

/**
 * State of one intercepted synchronization, created when it starts and passed along until it is
 * recorded. Never stored outside the call that created it.
 *
 * @param invocationId unique id, exposed in the MDC for log correlation
 * @param startedAt when the synchronization started
 */
public record SyncInvocation(String invocationId, Instant startedAt) {

    /** MDC key carrying {@link #invocationId()} while the synchronization runs. */
    public static final String MDC_INVOCATION_ID = "syncInvocationId";

    public SyncInvocation {
        if (invocationId == null || invocationId.isBlank()) {
            throw new IllegalArgumentException("invocationId must not be null or blank");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt must not be null");
        }
    }

    /**
     * Starts a new invocation at the clock's current instant.
     */
    public static SyncInvocation begin(Clock clock) {
        return new SyncInvocation(UUID.randomUUID().toString(), clock.instant());
    }

    /**
     * Runs the body with {@link #MDC_INVOCATION_ID} set to this invocation's id, then restores the
     * previous value (or removes the key if there was none). Nested invocations, such as an entity
     * synchronized inside a tracked pass, hand the outer id back when they finish.
     */
    public void runWithMdc(Runnable body) {
        String previous = MDC.get(MDC_INVOCATION_ID);
        MDC.put(MDC_INVOCATION_ID, invocationId);
        try {
            body.run();
        } finally {
            if (previous != null) {
                MDC.put(MDC_INVOCATION_ID, previous);
            } else {
                MDC.remove(MDC_INVOCATION_ID);
            }
        }
    }

    /**
     * Returns the time elapsed since the start, never negative.
     */
    public Duration elapsedUntil(Instant now) {
        Duration elapsed = Duration.between(startedAt, now);
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }
}
