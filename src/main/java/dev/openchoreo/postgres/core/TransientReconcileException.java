package dev.openchoreo.postgres.core;

import lombok.Getter;
import org.jspecify.annotations.NullMarked;

import java.time.Duration;

/**
 * Signals a reconciliation failure that is expected to resolve on its own.
 * The reconciliation should be attempted again after {@link #getRetryAfter()}.
 */
@NullMarked
@Getter
public class TransientReconcileException extends RuntimeException {
    private final Duration retryAfter;

    public TransientReconcileException(
            String message,
            Duration retryAfter
    ) {
        super(message);
        this.retryAfter = retryAfter;
    }
}
