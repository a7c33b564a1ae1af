package dev.openchoreo.postgres.core;

import org.jspecify.annotations.NullMarked;

import java.time.Duration;

@NullMarked
public class CredentialNotFoundException extends TransientReconcileException {
    public CredentialNotFoundException(
            String message,
            Duration retryAfter
    ) {
        super(message, retryAfter);
    }
}
