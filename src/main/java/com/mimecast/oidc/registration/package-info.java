/**
 * Client registrations and their lookup.
 *
 * <p>The {@link com.mimecast.oidc.registration.RegistrationResolver} is the asynchronous lookup
 * <br>used when a managed HTTP client is built for a registration.
 *
 * @see com.mimecast.oidc.registration.ClientRegistration
 * @see com.mimecast.oidc.registration.SigningCredential
 */
package com.mimecast.oidc.registration;
