package dev.openchoreo.postgres._support.testdata.creator;

import dev.openchoreo.postgres._support.testdata.base.TestDataCreator;
import dev.openchoreo.postgres.core.SecretKeyRef;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import lombok.AccessLevel;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Stores a password Secret and returns a {@link SecretKeyRef} pointing at it.
 * <p>
 * Values are written to {@code data} base64-encoded, the mock server does not translate {@code stringData}.
 */
@NullMarked
@Setter
@Accessors(fluent = true, chain = true)
public class PasswordSecretCreate extends TestDataCreator<SecretKeyRef> {
    public static final String DEFAULT_KEY = "password";

    private final KubernetesClient kubernetesClient;

    @Nullable
    private String withNamespace;

    @Nullable
    private String withName;

    @Nullable
    private String withKey;

    @Nullable
    private String withPassword;

    @Setter(AccessLevel.NONE)
    private boolean withoutData = false;

    public PasswordSecretCreate(
            int numberOfItems,
            KubernetesClient kubernetesClient
    ) {
        super(numberOfItems);
        this.kubernetesClient = kubernetesClient;
    }

    public PasswordSecretCreate withoutData() {
        this.withoutData = true;
        return this;
    }

    @Override
    protected SecretKeyRef create(int index) {
        var namespace = getNamespace();
        var name = getName();
        var key = getKey();

        var builder = new SecretBuilder()
                .withNewMetadata()
                .withNamespace(namespace)
                .withName(name)
                .endMetadata()
                .withType("Opaque");

        if (!withoutData) {
            builder.addToData(
                    key,
                    Base64.getEncoder().encodeToString(getPassword().getBytes(StandardCharsets.UTF_8))
            );
        }

        kubernetesClient.secrets()
                .inNamespace(namespace)
                .resource(builder.build())
                .create();

        return new SecretKeyRef()
                .setName(name)
                .setKey(key);
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

        return randomKubernetesNameSuffix("test-password");
    }

    private String getKey() {
        return Objects.requireNonNullElse(
                withKey,
                DEFAULT_KEY
        );
    }

    private String getPassword() {
        if (withPassword != null) {
            return withPassword;
        }

        return FAKER.credentials().password();
    }
}
