package dev.openchoreo.postgres.crd.postgresinstance;

import io.fabric8.kubernetes.api.model.Condition;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Status of a PostgresInstance as observed by the reconciler.
 */
@NullMarked
@Getter
@Setter
@Accessors(chain = true)
public class PostgresInstanceStatus {
    /**
     * Observed resource generation that the controller acted upon.
     */
    @Nullable
    private Long observedGeneration = null;

    /**
     * Name of the binding Secret holding the connection details.
     */
    @Nullable
    private String bindingSecretName = null;

    private List<Condition> conditions = new ArrayList<>();
}
