package dev.openchoreo.postgres.core;

import io.fabric8.generator.annotation.Required;
import io.fabric8.generator.annotation.ValidationRule;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * Reference to a single key of a Secret living in the same namespace as the resource referencing it.
 */
@NullMarked
@Getter
@Setter
@Accessors(chain = true)
public class SecretKeyRef {
    @Nullable
    @Required
    @ValidationRule(
            value = "self.trim().size() > 0",
            message = "The SecretKeyRef name must not be empty."
    )
    private String name;

    @Nullable
    @Required
    @ValidationRule(
            value = "self.trim().size() > 0",
            message = "The SecretKeyRef key must not be empty."
    )
    private String key;
}
