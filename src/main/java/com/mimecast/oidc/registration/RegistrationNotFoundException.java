package com.mimecast.oidc.registration;

/**
 * Thrown when no client registration matches a given identifier.
 */
public class RegistrationNotFoundException extends RuntimeException {

    private final String registrationId;

    /**
     * Constructs a new RegistrationNotFoundException.
     *
     * @param registrationId Registration identifier.
     */
    public RegistrationNotFoundException(String registrationId) {
        super("No client registration found for identifier: " + registrationId);
        this.registrationId = registrationId;
    }

    public String getRegistrationId() {
        return registrationId;
    }
}
