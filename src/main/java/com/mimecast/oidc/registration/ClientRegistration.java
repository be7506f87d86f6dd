package com.mimecast.oidc.registration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * OAuth/OIDC client registration.
 *
 * <p>Describes one client known to the authorization server.
 * <br>Signing credentials keep the order they were registered in, selection relies on it.
 */
public class ClientRegistration {

    private final String registrationId;
    private final String issuer;
    private final String clientId;
    private final List<SigningCredential> signingCredentials;

    private ClientRegistration(Builder builder) {
        this.registrationId = builder.registrationId;
        this.issuer = builder.issuer;
        this.clientId = builder.clientId;
        this.signingCredentials = Collections.unmodifiableList(new ArrayList<>(builder.signingCredentials));
    }

    public String getRegistrationId() {
        return registrationId;
    }

    public String getIssuer() {
        return issuer;
    }

    public String getClientId() {
        return clientId;
    }

    /**
     * Gets signing credentials in registration order.
     *
     * @return Unmodifiable list of SigningCredential.
     */
    public List<SigningCredential> getSigningCredentials() {
        return signingCredentials;
    }

    @Override
    public String toString() {
        return "ClientRegistration{registrationId=" + registrationId +
                ", issuer=" + issuer +
                ", clientId=" + clientId +
                ", signingCredentials=" + signingCredentials.size() +
                "}";
    }

    /**
     * Builder for ClientRegistration.
     */
    public static class Builder {
        private final String registrationId;
        private String issuer;
        private String clientId;
        private final List<SigningCredential> signingCredentials = new ArrayList<>();

        /**
         * Constructs a new Builder instance.
         *
         * @param registrationId Registration identifier.
         */
        public Builder(String registrationId) {
            this.registrationId = Objects.requireNonNull(registrationId, "registrationId must not be null");
        }

        public Builder withIssuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder withClientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        /**
         * Appends a signing credential.
         *
         * @param credential SigningCredential instance.
         * @return Builder instance.
         */
        public Builder addSigningCredential(SigningCredential credential) {
            signingCredentials.add(Objects.requireNonNull(credential, "credential must not be null"));
            return this;
        }

        public ClientRegistration build() {
            return new ClientRegistration(this);
        }
    }
}
