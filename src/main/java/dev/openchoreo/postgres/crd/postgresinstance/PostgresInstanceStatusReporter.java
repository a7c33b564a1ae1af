package dev.openchoreo.postgres.crd.postgresinstance;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.NullMarked;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

@NullMarked
@ApplicationScoped
public class PostgresInstanceStatusReporter {
    public static final String CONDITION_READY = "Ready";
    public static final String CONDITION_STATUS_TRUE = "True";
    public static final String REASON_SECRET_READY = "SecretReady";

    /**
     * Replace the status of the resource with the outcome of a successful reconciliation.
     * <p>
     * The condition list is rebuilt on every call and always holds a single {@code Ready=True} entry.
     * The framework persists the returned status as a patch of the status subresource.
     *
     * @param resource          the reconciled resource, its status is overwritten
     * @param bindingSecretName the name of the materialized binding Secret
     * @return the new status
     */
    public PostgresInstanceStatus ready(
            PostgresInstance resource,
            String bindingSecretName
    ) {
        var conditions = new ArrayList<Condition>(List.of(
                new ConditionBuilder()
                        .withType(CONDITION_READY)
                        .withStatus(CONDITION_STATUS_TRUE)
                        .withReason(REASON_SECRET_READY)
                        .withMessage("Binding Secret '%s' is ready.".formatted(bindingSecretName))
                        .withLastTransitionTime(now())
                        .build()
        ));

        var status = new PostgresInstanceStatus()
                .setObservedGeneration(resource.getMetadata().getGeneration())
                .setBindingSecretName(bindingSecretName)
                .setConditions(conditions);

        resource.setStatus(status);

        return status;
    }

    private static String now() {
        return OffsetDateTime.now(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.SECONDS)
                .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
