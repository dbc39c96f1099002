package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.config.CrmHttpProperties;
import java.net.http.HttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Hands each adapter a {@link RestClient.Builder} carrying the configured timeouts. */
@Component
@EnableConfigurationProperties(CrmHttpProperties.class)
public class CrmHttpClientFactory {

  private final CrmHttpProperties properties;

  public CrmHttpClientFactory(CrmHttpProperties properties) {
    this.properties = properties;
  }

  public RestClient.Builder newBuilder() {
    var httpClient =
        HttpClient.newBuilder()
            .connectTimeout(properties.connectTimeout())
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    var requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());
    return RestClient.builder().requestFactory(requestFactory);
  }
}
