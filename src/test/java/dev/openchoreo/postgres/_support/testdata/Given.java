package dev.openchoreo.postgres._support.testdata;

import dev.openchoreo.postgres._support.testdata.creator.PasswordSecretCreate;
import dev.openchoreo.postgres._support.testdata.creator.PostgresInstanceCreate;
import io.fabric8.kubernetes.client.KubernetesClient;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import org.jspecify.annotations.NullMarked;

@NullMarked
@ApplicationScoped
@RequiredArgsConstructor
public class Given {
    private final KubernetesClient kubernetesClient;

    public One one() {
        return new One();
    }

    public class One extends Item {
        One() {
            super(1);
        }
    }

    @RequiredArgsConstructor(access = AccessLevel.PACKAGE)
    public abstract class Item {
        private final int numberOfItems;

        public PasswordSecretCreate passwordSecret() {
            return new PasswordSecretCreate(
                    numberOfItems,
                    kubernetesClient
            );
        }

        public PostgresInstanceCreate postgresInstance() {
            return new PostgresInstanceCreate(
                    numberOfItems,
                    kubernetesClient
            );
        }
    }
}
