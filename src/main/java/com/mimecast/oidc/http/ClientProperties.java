package com.mimecast.oidc.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable properties decoded from a managed client name.
 *
 * <p>Scoped to a single client build. Unknown keys are carried but ignored by the integration.
 *
 * @see ClientNameCodec
 */
public class ClientProperties {

    /**
     * Identifier of the registration the client belongs to.
     */
    public static final String REGISTRATION_ID = "RegistrationId";

    /**
     * Boolean flag requesting a certificate for standard TLS client authentication.
     */
    public static final String ATTACH_TLS_CLIENT_CERTIFICATE = "AttachTlsClientCertificate";

    /**
     * Boolean flag requesting a certificate for self-signed TLS client authentication.
     */
    public static final String ATTACH_SELF_SIGNED_TLS_CLIENT_CERTIFICATE = "AttachSelfSignedTlsClientCertificate";

    private static final ClientProperties EMPTY = new ClientProperties(Collections.emptyMap());

    private final Map<String, String> properties;

    /**
     * Constructs a new ClientProperties instance.
     *
     * @param properties Map of String, String.
     */
    public ClientProperties(Map<String, String> properties) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Gets empty properties.
     *
     * @return ClientProperties instance.
     */
    public static ClientProperties empty() {
        return EMPTY;
    }

    /**
     * Gets property value.
     *
     * @param key Property key.
     * @return Optional of String.
     */
    public Optional<String> get(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    /**
     * Gets property as boolean.
     * <p>Only a case-insensitive <i>true</i> is true.
     *
     * @param key Property key.
     * @return Boolean.
     */
    public boolean getBoolean(String key) {
        return Boolean.parseBoolean(properties.get(key));
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    public int size() {
        return properties.size();
    }

    /**
     * Gets properties as map.
     *
     * @return Unmodifiable map.
     */
    public Map<String, String> asMap() {
        return properties;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClientProperties)) return false;
        return properties.equals(((ClientProperties) o).properties);
    }

    @Override
    public int hashCode() {
        return properties.hashCode();
    }

    @Override
    public String toString() {
        return properties.toString();
    }
}
