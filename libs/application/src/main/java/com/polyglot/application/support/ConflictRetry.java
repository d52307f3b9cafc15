package com.polyglot.application.support;

import com.polyglot.domain.exception.ConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Retries a load-mutate-save cycle once when the save loses an optimistic-concurrency race.
 * <p>
 * The attempt must reload every aggregate it saves, otherwise the retry saves the same stale copy.
 * A second {@link ConflictException} propagates to the caller. No other exception is caught.
 */
public final class ConflictRetry {

    private static final Logger log = LoggerFactory.getLogger(ConflictRetry.class);

    private ConflictRetry() {
        // utility class
    }

    public static <T> T retryOnce(String operation, Supplier<T> attempt) {
        try {
            return attempt.get();
        } catch (ConflictException conflict) {
            log.warn("Conflict on {} '{}' during {} (expected version {}, found {}), retrying once",
                    conflict.resourceType(), conflict.resourceId(), operation,
                    conflict.expectedVersion(), conflict.actualVersion());
            return attempt.get();
        }
    }

    public static void retryOnce(String operation, Runnable attempt) {
        retryOnce(operation, () -> {
            attempt.run();
            return null;
        });
    }
}
