/**
 * Retry and resilience handlers placed in front of the primary handler.
 *
 * <p>A managed client carries at most one of:
 * <ul>
 *   <li>{@link com.mimecast.oidc.resilience.HttpErrorPolicy} run by a {@link com.mimecast.oidc.resilience.PolicyInterceptor}.</li>
 *   <li>{@link com.mimecast.oidc.resilience.ResiliencePipeline} run by a {@link com.mimecast.oidc.resilience.ResilienceInterceptor}.</li>
 * </ul>
 *
 * @see com.mimecast.oidc.resilience.TransientErrorRetryPolicy
 */
package com.mimecast.oidc.resilience;
