package dev.openchoreo.postgres.crd.postgresinstance;

import dev.openchoreo.postgres.core.KubernetesService;
import dev.openchoreo.postgres.core.PermanentReconcileException;
import dev.openchoreo.postgres.core.TransientReconcileException;
import io.fabric8.kubernetes.api.model.Secret;
import io.javaoperatorsdk.operator.api.config.informer.InformerEventSourceConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceContext;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import io.javaoperatorsdk.operator.processing.event.source.EventSource;
import io.javaoperatorsdk.operator.processing.event.source.SecondaryToPrimaryMapper;
import io.javaoperatorsdk.operator.processing.event.source.informer.InformerEventSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

@NullMarked
@Slf4j
@RequiredArgsConstructor
public class PostgresInstanceReconciler implements Reconciler<PostgresInstance> {
    private final KubernetesService kubernetesService;
    private final BindingSecretService bindingSecretService;
    private final PostgresInstanceStatusReporter statusReporter;

    @Override
    public UpdateControl<PostgresInstance> reconcile(
            PostgresInstance resource,
            Context<PostgresInstance> context
    ) {
        var spec = resource.getSpec();

        var name = resource.getMetadata().getName();
        var namespace = resource.getMetadata().getNamespace();

        log.info(
                "Reconciling PostgresInstance [resource={}/{}, generation={}]",
                namespace,
                name,
                resource.getMetadata().getGeneration()
        );

        validate(resource);

        var passwordSecretRef = Objects.requireNonNull(spec.getPasswordSecretRef());
        var host = Objects.requireNonNull(spec.getHost());
        var database = Objects.requireNonNull(spec.getDatabase());
        var username = Objects.requireNonNull(spec.getUsername());
        var port = getPortOrDefault(spec);
        var bindingSecretName = getBindingSecretNameOrDefault(resource);

        String password;
        try {
            password = kubernetesService.getSecretValue(
                    namespace,
                    Objects.requireNonNull(passwordSecretRef.getName()),
                    Objects.requireNonNull(passwordSecretRef.getKey())
            );
        } catch (TransientReconcileException e) {
            log.warn(
                    "PostgresInstance not ready yet, retrying [resource={}/{}, retryAfter={}, reason={}]",
                    namespace,
                    name,
                    e.getRetryAfter(),
                    e.getMessage()
            );

            return UpdateControl.<PostgresInstance>noUpdate()
                    .rescheduleAfter(e.getRetryAfter().toMillis(), TimeUnit.MILLISECONDS);
        }

        var databaseUrl = DatabaseUrlBuilder.build(
                host,
                port,
                database,
                username,
                password,
                spec.getSslMode(),
                spec.getAdditionalParams()
        );

        bindingSecretService.upsert(
                namespace,
                bindingSecretName,
                BindingSecretService.controllerOwnerReference(resource),
                new BindingSecretData(
                        databaseUrl,
                        host,
                        port,
                        database,
                        username,
                        password
                )
        );

        statusReporter.ready(resource, bindingSecretName);

        log.info(
                "PostgresInstance ready [resource={}/{}, bindingSecret={}]",
                namespace,
                name,
                bindingSecretName
        );

        return UpdateControl.patchStatus(resource);
    }

    /**
     * Invalid specs are not retried and the status is left untouched. Any other error keeps the
     * framework's default retry.
     */
    @Override
    public ErrorStatusUpdateControl<PostgresInstance> updateErrorStatus(
            PostgresInstance resource,
            Context<PostgresInstance> context,
            Exception e
    ) {
        if (e instanceof PermanentReconcileException) {
            return ErrorStatusUpdateControl.<PostgresInstance>noStatusUpdate()
                    .withNoRetry();
        }

        log.error(
                "Failed to reconcile PostgresInstance [resource={}/{}]",
                resource.getMetadata().getNamespace(),
                resource.getMetadata().getName(),
                e
        );

        return ErrorStatusUpdateControl.noStatusUpdate();
    }

    /**
     * Watches for {@code Secret} changes to trigger reconciliation of the {@code PostgresInstance} resources
     * that either read their password from the Secret or own it as their binding Secret.
     */
    @Override
    public List<EventSource<?, PostgresInstance>> prepareEventSources(EventSourceContext<PostgresInstance> context) {
        SecondaryToPrimaryMapper<Secret> secretToInstanceMapper = (Secret secret) -> context.getPrimaryCache()
                .list()
                .filter(instance -> isReferencedBy(instance, secret) || isOwnedBy(instance, secret))
                .map(ResourceID::fromResource)
                .collect(Collectors.toSet());

        var eventSourceConfig = InformerEventSourceConfiguration.from(Secret.class, PostgresInstance.class)
                .withSecondaryToPrimaryMapper(secretToInstanceMapper)
                .withNamespacesInheritedFromController()
                .build();

        var secretEventSource = new InformerEventSource<>(
                eventSourceConfig,
                context
        );

        return List.of(secretEventSource);
    }

    static void validate(PostgresInstance resource) {
        var spec = resource.getSpec();

        var missing = new ArrayList<String>();

        //noinspection ConstantConditions
        if (spec == null) {
            missing.add("spec");
        } else {
            if (isBlank(spec.getHost())) {
                missing.add("spec.host");
            }
            if (isBlank(spec.getDatabase())) {
                missing.add("spec.database");
            }
            if (isBlank(spec.getUsername())) {
                missing.add("spec.username");
            }

            var passwordSecretRef = spec.getPasswordSecretRef();
            if (passwordSecretRef == null || isBlank(passwordSecretRef.getName())) {
                missing.add("spec.passwordSecretRef.name");
            }
            if (passwordSecretRef == null || isBlank(passwordSecretRef.getKey())) {
                missing.add("spec.passwordSecretRef.key");
            }
        }

        if (missing.isEmpty()) {
            return;
        }

        log.error(
                "Invalid PostgresInstance, not retrying until the spec changes [resource={}/{}, missing={}]",
                resource.getMetadata().getNamespace(),
                resource.getMetadata().getName(),
                missing
        );

        throw new PermanentReconcileException(
                "spec.host, spec.database, spec.username, spec.passwordSecretRef.{name,key} are required [missing=%s]".formatted(
                        String.join(", ", missing)
                )
        );
    }

    static int getPortOrDefault(PostgresInstanceSpec spec) {
        return Objects.requireNonNullElse(
                spec.getPort(),
                PostgresInstanceSpec.DEFAULT_PORT
        );
    }

    static String getBindingSecretNameOrDefault(PostgresInstance resource) {
        var bindingSecretName = resource.getSpec().getBindingSecretName();

        if (bindingSecretName == null || bindingSecretName.isEmpty()) {
            return "%s-binding".formatted(resource.getMetadata().getName());
        }

        return bindingSecretName;
    }

    /**
     * Checks if the given PostgresInstance's spec.passwordSecretRef points to the changed Secret.
     */
    static boolean isReferencedBy(
            PostgresInstance instance,
            Secret secret
    ) {
        var spec = instance.getSpec();

        //noinspection ConstantConditions
        if (spec == null || spec.getPasswordSecretRef() == null) {
            return false;
        }

        var refName = Objects.requireNonNull(spec.getPasswordSecretRef()).getName();

        return Objects.equals(refName, secret.getMetadata().getName())
                && Objects.equals(instance.getMetadata().getNamespace(), secret.getMetadata().getNamespace());
    }

    static boolean isOwnedBy(
            PostgresInstance instance,
            Secret secret
    ) {
        var uid = instance.getMetadata().getUid();

        return uid != null && secret.getMetadata().getOwnerReferences()
                .stream()
                .anyMatch(ownerReference -> uid.equals(ownerReference.getUid()));
    }

    // Stricter than non-empty: whitespace-only counts as missing, the same as the CRD rule self.trim().size() > 0.
    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }
}
