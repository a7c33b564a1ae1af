package dev.openchoreo.postgres.core;

import io.fabric8.kubernetes.client.KubernetesClient;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.NullMarked;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

@NullMarked
@Slf4j
@ApplicationScoped
public class KubernetesService {
    private final KubernetesClient kubernetesClient;
    private final Duration credentialRetryDelay;

    public KubernetesService(
            KubernetesClient kubernetesClient,
            @ConfigProperty(
                    name = "openchoreo.postgres-instance.credential-retry-delay",
                    defaultValue = "10s"
            )
            Duration credentialRetryDelay
    ) {
        this.kubernetesClient = kubernetesClient;
        this.credentialRetryDelay = credentialRetryDelay;
    }

    /**
     * Read a single value from a Secret and decode it from its base64 representation.
     * <p>
     * A missing Secret or a missing key is reported as a retryable {@link CredentialNotFoundException}.
     *
     * @param namespace  the namespace of the Secret
     * @param secretName the name of the Secret
     * @param key        the data key to read
     * @return the decoded UTF-8 value
     */
    public String getSecretValue(
            String namespace,
            String secretName,
            String key
    ) {
        var secret = kubernetesClient.secrets()
                .inNamespace(namespace)
                .withName(secretName)
                .get();

        //noinspection ConstantConditions
        if (secret == null) {
            log.warn(
                    "Referenced Secret does not exist (yet) [secret={}/{}]",
                    namespace,
                    secretName
            );

            throw new CredentialNotFoundException(
                    "Secret '%s' not found in namespace '%s'.".formatted(
                            secretName,
                            namespace
                    ),
                    credentialRetryDelay
            );
        }

        var data = secret.getData();
        if (data == null || !data.containsKey(key) || data.get(key) == null) {
            log.warn(
                    "Referenced Secret is missing the requested key [secret={}/{}, key={}]",
                    namespace,
                    secretName,
                    key
            );

            throw new CredentialNotFoundException(
                    "Secret '%s' missing key '%s'.".formatted(
                            secretName,
                            key
                    ),
                    credentialRetryDelay
            );
        }

        return new String(
                Base64.getDecoder().decode(data.get(key)),
                StandardCharsets.UTF_8
        );
    }
}
