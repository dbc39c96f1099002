package io.b2mash.crmsync.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Timeouts applied to every outbound CRM call.
 *
 * @param connectTimeout time allowed to open the connection (default 5s)
 * @param readTimeout time allowed for the whole response (default 10s)
 */
@ConfigurationProperties(prefix = "crmsync.http")
public record CrmHttpProperties(Duration connectTimeout, Duration readTimeout) {

  public CrmHttpProperties {
    if (connectTimeout == null) {
      connectTimeout = Duration.ofSeconds(5);
    }
    if (readTimeout == null) {
      readTimeout = Duration.ofSeconds(10);
    }
  }
}
