package dev.openchoreo.postgres.core;

import org.jspecify.annotations.NullMarked;

/**
 * Signals a reconciliation failure that retrying cannot fix, typically an invalid spec.
 * The resource stays as it is until someone edits it.
 */
@NullMarked
public class PermanentReconcileException extends RuntimeException {
    public PermanentReconcileException(String message) {
        super(message);
    }
}
