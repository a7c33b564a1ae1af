package dev.openchoreo.postgres.crd.postgresinstance;

import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.PatchContext;
import io.fabric8.kubernetes.client.dsl.base.PatchType;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jspecify.annotations.NullMarked;

import java.net.HttpURLConnection;
import java.util.List;
import java.util.Map;

@NullMarked
@Slf4j
@ApplicationScoped
@RequiredArgsConstructor
public class BindingSecretService {
    public static final String SECRET_TYPE_OPAQUE = "Opaque";
    public static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY_VALUE = "postgresinstance-controller";

    private final KubernetesClient kubernetesClient;

    /**
     * Build an owner reference that makes the given PostgresInstance the controlling owner,
     * so the binding Secret is garbage collected together with it.
     */
    public static OwnerReference controllerOwnerReference(PostgresInstance owner) {
        return new OwnerReferenceBuilder()
                .withApiVersion(owner.getApiVersion())
                .withKind(owner.getKind())
                .withName(owner.getMetadata().getName())
                .withUid(owner.getMetadata().getUid())
                .withController(true)
                .withBlockOwnerDeletion(true)
                .build();
    }

    public Secret desiredSecret(
            String namespace,
            String secretName,
            OwnerReference ownerReference,
            BindingSecretData data
    ) {
        return new SecretBuilder()
                .withApiVersion("v1")
                .withKind("Secret")
                .withNewMetadata()
                .withNamespace(namespace)
                .withName(secretName)
                .withOwnerReferences(ownerReference)
                .withLabels(Map.of(MANAGED_BY_LABEL, MANAGED_BY_VALUE))
                .endMetadata()
                .withType(SECRET_TYPE_OPAQUE)
                .withData(data.toData())
                .build();
    }

    /**
     * Create the binding Secret, or overwrite it when it already exists.
     * <p>
     * There is no read before the write: the create is attempted first and a conflict falls back to a JSON patch
     * that replaces data, labels and owner references wholesale, so keys left on the existing Secret are dropped
     * and concurrent writers resolve as last-write-wins. Errors other than the conflict are propagated.
     */
    public void upsert(
            String namespace,
            String secretName,
            OwnerReference ownerReference,
            BindingSecretData data
    ) {
        var secret = desiredSecret(
                namespace,
                secretName,
                ownerReference,
                data
        );

        try {
            kubernetesClient.secrets()
                    .inNamespace(namespace)
                    .resource(secret)
                    .create();

            log.info(
                    "Created binding Secret [secret={}/{}]",
                    namespace,
                    secretName
            );

            return;
        } catch (KubernetesClientException e) {
            if (e.getCode() != HttpURLConnection.HTTP_CONFLICT) {
                throw e;
            }
        }

        kubernetesClient.secrets()
                .inNamespace(namespace)
                .withName(secretName)
                .patch(
                        PatchContext.of(PatchType.JSON),
                        overwritePatch(secret)
                );

        log.info(
                "Updated binding Secret [secret={}/{}]",
                namespace,
                secretName
        );
    }

    /**
     * JSON patch {@code add} on an existing member replaces it, and creates it when absent.
     */
    private String overwritePatch(Secret secret) {
        var metadata = secret.getMetadata();
        List<Map<String, Object>> operations = List.of(
                Map.of("op", "add", "path", "/metadata/labels", "value", metadata.getLabels()),
                Map.of("op", "add", "path", "/metadata/ownerReferences", "value", metadata.getOwnerReferences()),
                Map.of("op", "add", "path", "/data", "value", secret.getData())
        );

        return kubernetesClient.getKubernetesSerialization()
                .asJson(operations);
    }
}
