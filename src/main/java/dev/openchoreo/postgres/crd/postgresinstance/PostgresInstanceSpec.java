package dev.openchoreo.postgres.crd.postgresinstance;

import dev.openchoreo.postgres.core.SecretKeyRef;
import io.fabric8.generator.annotation.Max;
import io.fabric8.generator.annotation.Min;
import io.fabric8.generator.annotation.Required;
import io.fabric8.generator.annotation.ValidationRule;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection details of a PostgreSQL database that should be exposed as a binding Secret.
 * <p>
 * Required fields are nullable here, the reconciler validates them before use.
 */
@NullMarked
@Getter
@Setter
@Accessors(chain = true)
public class PostgresInstanceSpec {
    public static final int DEFAULT_PORT = 5432;

    @Nullable
    @Required
    @ValidationRule(
            value = "self.trim().size() > 0",
            message = "The PostgresInstance host must not be empty."
    )
    private String host;

    @Nullable
    @io.fabric8.generator.annotation.Nullable
    @Min(1)
    @Max(65535)
    private Integer port;

    @Nullable
    @Required
    @ValidationRule(
            value = "self.trim().size() > 0",
            message = "The PostgresInstance database must not be empty."
    )
    private String database;

    @Nullable
    @Required
    @ValidationRule(
            value = "self.trim().size() > 0",
            message = "The PostgresInstance username must not be empty."
    )
    private String username;

    /**
     * Rendered as the {@code sslmode} query parameter, e.g. {@code require} or {@code verify-full}.
     */
    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private String sslMode;

    /**
     * Extra query parameters appended to the connection URL after {@code sslmode}, in declaration order.
     */
    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private Map<String, @Nullable String> additionalParams = new LinkedHashMap<>();

    @Nullable
    @Required
    private SecretKeyRef passwordSecretRef;

    /**
     * Name of the generated Secret. Defaults to {@code <metadata.name>-binding}.
     */
    @Nullable
    @io.fabric8.generator.annotation.Nullable
    private String bindingSecretName;
}
