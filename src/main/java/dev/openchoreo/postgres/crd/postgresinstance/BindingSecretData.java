package dev.openchoreo.postgres.crd.postgresinstance;

import org.jspecify.annotations.NullMarked;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The six values exposed to workloads through the binding Secret.
 */
@NullMarked
public record BindingSecretData(
        String databaseUrl,
        String host,
        int port,
        String database,
        String username,
        String password
) {
    public static final String DATABASE_URL_KEY = "DATABASE_URL";
    public static final String DB_HOST_KEY = "DB_HOST";
    public static final String DB_PORT_KEY = "DB_PORT";
    public static final String DB_NAME_KEY = "DB_NAME";
    public static final String DB_USER_KEY = "DB_USER";
    public static final String DB_PASSWORD_KEY = "DB_PASSWORD";

    /**
     * @return the plain values keyed by their Secret data key
     */
    public Map<String, String> toStringData() {
        var result = new LinkedHashMap<String, String>();

        result.put(DATABASE_URL_KEY, databaseUrl);
        result.put(DB_HOST_KEY, host);
        result.put(DB_PORT_KEY, String.valueOf(port));
        result.put(DB_NAME_KEY, database);
        result.put(DB_USER_KEY, username);
        result.put(DB_PASSWORD_KEY, password);

        return result;
    }

    /**
     * @return the values base64-encoded, as stored in {@code Secret.data}
     */
    public Map<String, String> toData() {
        var encoder = Base64.getEncoder();
        var result = new LinkedHashMap<String, String>();

        toStringData().forEach((key, value) -> result.put(
                key,
                encoder.encodeToString(value.getBytes(StandardCharsets.UTF_8))
        ));

        return result;
    }
}
