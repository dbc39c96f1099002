package io.b2mash.crmsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param exposeErrors when true, unexpected server errors carry the exception message in the
 *     problem detail. Off in production.
 */
@ConfigurationProperties(prefix = "crmsync.diagnostics")
public record DiagnosticsProperties(boolean exposeErrors) {}
