/**
 * HTTP front end for the leak classifier: environment-driven
 * {@link com.leaksentinel.server.ServerConfig}, CSV dataset loading and the
 * {@link com.leaksentinel.server.AnalysisHttpServer} JSON API.
 *
 * @since 1.0.0
 */
package com.leaksentinel.server;
