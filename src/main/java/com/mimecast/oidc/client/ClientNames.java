package com.mimecast.oidc.client;

import com.mimecast.oidc.http.ClientNameCodec;
import com.mimecast.oidc.http.ClientProperties;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds managed client names.
 *
 * <p>Validates what the codec does not: keys and values must be non-empty
 * <br>and free of separator characters to survive decoding.
 */
public class ClientNames {

    /**
     * Private constructor.
     */
    private ClientNames() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Creates a client name for a registration and authentication method.
     *
     * @param prefix         Name prefix.
     * @param registrationId Registration identifier.
     * @param method         Client authentication method.
     * @return Client name.
     */
    public static String forRegistration(String prefix, String registrationId, ClientAuthenticationMethod method) {
        Map<String, String> properties = new LinkedHashMap<>();
        properties.put(ClientProperties.REGISTRATION_ID, registrationId);

        if (method == ClientAuthenticationMethod.TLS_CLIENT_AUTH) {
            properties.put(ClientProperties.ATTACH_TLS_CLIENT_CERTIFICATE, "true");
        } else if (method == ClientAuthenticationMethod.SELF_SIGNED_TLS_CLIENT_AUTH) {
            properties.put(ClientProperties.ATTACH_SELF_SIGNED_TLS_CLIENT_CERTIFICATE, "true");
        }

        return create(prefix, properties);
    }

    /**
     * Creates a client name from arbitrary properties.
     *
     * @param prefix     Name prefix.
     * @param properties Map of String, String.
     * @return Client name.
     * @throws IllegalArgumentException If a key or value cannot be encoded.
     */
    public static String create(String prefix, Map<String, String> properties) {
        Validate.notEmpty(prefix, "prefix must not be empty");
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            validate(entry.getKey(), "key");
            validate(entry.getValue(), "value of " + entry.getKey());
        }
        return ClientNameCodec.encode(prefix, properties);
    }

    private static void validate(String text, String what) {
        Validate.notEmpty(text, "%s must not be empty", what);
        Validate.isTrue(StringUtils.containsNone(text, ClientNameCodec.ENTRY_SEPARATOR, ClientNameCodec.PAIR_SEPARATOR),
                "%s must not contain separator characters", what);
    }
}
