package dev.openchoreo.postgres.crd.postgresinstance;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;
import org.jspecify.annotations.NullMarked;

@NullMarked
@Group(PostgresInstance.GROUP)
@Version(PostgresInstance.VERSION)
@Kind(PostgresInstance.KIND)
@Plural(PostgresInstance.PLURAL)
public class PostgresInstance
        extends CustomResource<PostgresInstanceSpec, PostgresInstanceStatus>
        implements Namespaced {
    public static final String GROUP = "openchoreo.dev";
    public static final String VERSION = "v1alpha1";
    public static final String KIND = "PostgresInstance";
    public static final String PLURAL = "postgresinstances";
}
