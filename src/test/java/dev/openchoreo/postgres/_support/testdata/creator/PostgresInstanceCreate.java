package dev.openchoreo.postgres._support.testdata.creator;

import dev.openchoreo.postgres._support.testdata.base.TestDataCreator;
import dev.openchoreo.postgres.core.SecretKeyRef;
import dev.openchoreo.postgres.crd.postgresinstance.PostgresInstance;
import dev.openchoreo.postgres.crd.postgresinstance.PostgresInstanceSpec;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds a PostgresInstance as the reconciler receives it from the informer cache.
 * The resource is not stored, the reconciler never reads it back.
 */
@NullMarked
@Setter
@Accessors(fluent = true, chain = true)
public class PostgresInstanceCreate extends TestDataCreator<PostgresInstance> {
    private final KubernetesClient kubernetesClient;

    @Nullable
    private String withNamespace;

    @Nullable
    private String withName;

    @Nullable
    private Long withGeneration;

    @Nullable
    private String withHost = "db.example";

    @Nullable
    private Integer withPort;

    @Nullable
    private String withDatabase = "app";

    @Nullable
    private String withUsername = "svc";

    @Nullable
    private String withSslMode;

    @Nullable
    private Map<String, @Nullable String> withAdditionalParams;

    @Nullable
    private SecretKeyRef withPasswordSecretRef;

    @Nullable
    private String withBindingSecretName;

    public PostgresInstanceCreate(
            int numberOfItems,
            KubernetesClient kubernetesClient
    ) {
        super(numberOfItems);
        this.kubernetesClient = kubernetesClient;
    }

    @Override
    protected PostgresInstance create(int index) {
        var item = new PostgresInstance();

        item.setMetadata(new ObjectMetaBuilder()
                .withNamespace(getNamespace())
                .withName(getName())
                .withUid(UUID.randomUUID().toString())
                .withGeneration(Objects.requireNonNullElse(withGeneration, 1L))
                .build()
        );

        var spec = new PostgresInstanceSpec()
                .setHost(withHost)
                .setPort(withPort)
                .setDatabase(withDatabase)
                .setUsername(withUsername)
                .setSslMode(withSslMode)
                .setAdditionalParams(getAdditionalParams())
                .setPasswordSecretRef(withPasswordSecretRef)
                .setBindingSecretName(withBindingSecretName);

        item.setSpec(spec);

        return item;
    }

    private String getNamespace() {
        return Objects.requireNonNullElse(
                withNamespace,
                kubernetesClient.getNamespace()
        );
    }

    private String getName() {
        if (withName != null) {
            return withName;
        }

        return randomKubernetesNameSuffix("test-postgres-instance");
    }

    private Map<String, @Nullable String> getAdditionalParams() {
        if (withAdditionalParams != null) {
            return new LinkedHashMap<>(withAdditionalParams);
        }

        return new LinkedHashMap<>();
    }
}
