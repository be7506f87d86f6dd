/**
 * Handles the file based configuration of the HTTP integration.
 *
 * <p>Provides the map backed configuration foundation and typed accessors.
 * <br>Configuration files are JSON5 and read with Gson.
 *
 * <p><b>Example:</b>
 * <pre>HttpIntegrationConfig config = HttpIntegrationConfig.load(Paths.get("cfg/oidc-http.json5"));</pre>
 *
 * @see com.mimecast.oidc.config.BasicConfig
 * @see com.mimecast.oidc.config.HttpIntegrationConfig
 */
package com.mimecast.oidc.config;
