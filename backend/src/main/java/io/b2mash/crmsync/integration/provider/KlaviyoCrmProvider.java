package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.canonical.CanonicalEvent;
import io.b2mash.crmsync.canonical.ContactIdentifier;
import io.b2mash.crmsync.integration.CrmType;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClient.RequestHeadersSpec.ConvertibleClientHttpResponse;

/**
 * Klaviyo adapter over the JSON:API endpoints at {@code a.klaviyo.com/api}. Credentials: {@code
 * api_key} (a private key).
 */
@Component
@CrmAdapter(CrmType.KLAVIYO)
public class KlaviyoCrmProvider implements CrmProvider {

  private static final Logger log = LoggerFactory.getLogger(KlaviyoCrmProvider.class);

  static final String BASE_URL = "https://a.klaviyo.com/api";
  static final String API_REVISION = "2025-10-15";
  private static final MediaType JSON_API = MediaType.parseMediaType("application/vnd.api+json");
  private static final CrmType TYPE = CrmType.KLAVIYO;

  private final RestClient restClient;
  private final String baseUrl;

  @Autowired
  public KlaviyoCrmProvider(CrmHttpClientFactory httpClientFactory) {
    this(httpClientFactory.newBuilder(), BASE_URL);
  }

  /** Package-private constructor for testing -- allows binding a mock server to the builder. */
  KlaviyoCrmProvider(RestClient.Builder restClientBuilder, String baseUrl) {
    this.restClient = restClientBuilder.build();
    this.baseUrl = baseUrl;
  }

  @Override
  public boolean validateCredentials(CrmCredentials credentials) {
    var apiKey = requireApiKey(credentials);
    return CrmHttp.call(
        TYPE,
        "credential validation",
        () ->
            restClient
                .get()
                .uri(CrmHttp.uri(baseUrl, "/profiles", Map.of("page[size]", 1)))
                .headers(headers -> applyHeaders(headers, apiKey))
                .exchange(
                    (request, response) -> {
                      int status = response.getStatusCode().value();
                      if (status >= 400) {
                        throw error("credential validation", status, response);
                      }
                      return true;
                    }));
  }

  @Override
  public RemoteRecord upsertContact(CrmCredentials credentials, Map<String, Object> payload) {
    var apiKey = requireApiKey(credentials);
    var profile = new LinkedHashMap<String, Object>();
    profile.put("type", "profile");
    profile.put("attributes", profileAttributes(payload));
    var body = Map.of("data", profile);

    return CrmHttp.call(
        TYPE,
        "contact upsert",
        () ->
            restClient
                .post()
                .uri(CrmHttp.uri(baseUrl, "/profile-import"))
                .headers(headers -> applyHeaders(headers, apiKey))
                .contentType(JSON_API)
                .body(body)
                .exchange(
                    (request, response) -> {
                      int status = response.getStatusCode().value();
                      if (status >= 400) {
                        throw error("contact upsert", status, response);
                      }
                      return new RemoteRecord(status, CrmHttp.readObject(response));
                    }));
  }

  @Override
  public RemoteRecord sendEvent(
      CrmCredentials credentials, ContactIdentifier contact, CanonicalEvent event) {
    var apiKey = requireApiKey(credentials);
    if (!contact.hasAny()) {
      throw new CrmApiException(TYPE, "Contact id, email or phone is required to send an event");
    }

    var attributes = new LinkedHashMap<String, Object>();
    attributes.put("properties", event.properties());
    attributes.put("time", event.timestamp().toString());
    if (event.value() != null) {
      attributes.put("value", event.value());
    }
    attributes.put(
        "metric",
        Map.of("data", Map.of("type", "metric", "attributes", Map.of("name", event.name()))));
    attributes.put("profile", Map.of("data", profileReference(contact)));
    var body = Map.of("data", Map.of("type", "event", "attributes", attributes));

    return CrmHttp.call(
        TYPE,
        "event send",
        () ->
            restClient
                .post()
                .uri(CrmHttp.uri(baseUrl, "/events"))
                .headers(headers -> applyHeaders(headers, apiKey))
                .contentType(JSON_API)
                .body(body)
                .exchange(
                    (request, response) -> {
                      int status = response.getStatusCode().value();
                      if (status >= 400) {
                        throw error("event send", status, response);
                      }
                      log.debug("Klaviyo accepted event '{}' with status {}", event.name(), status);
                      return new RemoteRecord(status, CrmHttp.readObject(response));
                    }));
  }

  @Override
  public Optional<Map<String, Object>> getContact(
      CrmCredentials credentials, ContactIdentifier contact) {
    var apiKey = requireApiKey(credentials);
    if (contact.id() != null) {
      return CrmHttp.call(
          TYPE,
          "contact lookup",
          () ->
              restClient
                  .get()
                  .uri(CrmHttp.uri(baseUrl, "/profiles/{id}", contact.id()))
                  .headers(headers -> applyHeaders(headers, apiKey))
                  .exchange(
                      (request, response) -> {
                        int status = response.getStatusCode().value();
                        if (status == 404) {
                          return Optional.<Map<String, Object>>empty();
                        }
                        if (status >= 400) {
                          throw error("contact lookup", status, response);
                        }
                        return dataObject(CrmHttp.readObject(response));
                      }));
    }

    String filter;
    if (contact.email() != null) {
      filter = "equals(email,\"" + escapeFilterValue(contact.email()) + "\")";
    } else if (contact.phone() != null) {
      filter = "equals(phone_number,\"" + escapeFilterValue(contact.phone()) + "\")";
    } else {
      throw new CrmApiException(TYPE, "Contact id, email or phone is required");
    }

    return CrmHttp.call(
        TYPE,
        "contact search",
        () ->
            restClient
                .get()
                .uri(CrmHttp.uri(baseUrl, "/profiles", Map.of("filter", filter)))
                .headers(headers -> applyHeaders(headers, apiKey))
                .exchange(
                    (request, response) -> {
                      int status = response.getStatusCode().value();
                      if (status >= 400) {
                        throw error("contact search", status, response);
                      }
                      var profiles = CrmHttp.objectList(CrmHttp.readObject(response), "data");
                      return profiles.isEmpty()
                          ? Optional.<Map<String, Object>>empty()
                          : Optional.of(profiles.get(0));
                    }));
  }

  private static String requireApiKey(CrmCredentials credentials) {
    var apiKey = credentials.get("api_key");
    if (apiKey == null) {
      throw new CrmAuthenticationException(TYPE, "Klaviyo api_key is required");
    }
    return apiKey;
  }

  private static void applyHeaders(HttpHeaders headers, String apiKey) {
    headers.set(HttpHeaders.AUTHORIZATION, "Klaviyo-API-Key " + apiKey);
    headers.set("revision", API_REVISION);
    headers.setAccept(List.of(JSON_API, MediaType.APPLICATION_JSON));
  }

  private static CrmProviderException error(
      String operation, int status, ConvertibleClientHttpResponse response) {
    if (status == 401) {
      return new CrmAuthenticationException(TYPE, "Invalid Klaviyo API key");
    }
    if (status == 403) {
      return new CrmAuthenticationException(TYPE, "Klaviyo API key lacks required permissions");
    }
    return CrmHttp.apiError(TYPE, operation, status, response);
  }

  /** Flattens the mapped {@code {attributes, properties}} payload into profile attributes. */
  @SuppressWarnings("unchecked")
  private static Map<String, Object> profileAttributes(Map<String, Object> payload) {
    var attributes = new LinkedHashMap<String, Object>();
    if (payload.get("attributes") instanceof Map<?, ?> mapped) {
      attributes.putAll((Map<String, Object>) mapped);
    }
    if (payload.get("properties") instanceof Map<?, ?> properties && !properties.isEmpty()) {
      attributes.put("properties", properties);
    }
    return attributes;
  }

  private static Map<String, Object> profileReference(ContactIdentifier contact) {
    var profile = new LinkedHashMap<String, Object>();
    profile.put("type", "profile");
    if (contact.id() != null) {
      profile.put("id", contact.id());
      return profile;
    }
    var attributes = new LinkedHashMap<String, Object>();
    if (contact.email() != null) {
      attributes.put("email", contact.email());
    }
    if (contact.phone() != null) {
      attributes.put("phone_number", contact.phone());
    }
    profile.put("attributes", attributes);
    return profile;
  }

  @SuppressWarnings("unchecked")
  private static Optional<Map<String, Object>> dataObject(Map<String, Object> body) {
    if (body.get("data") instanceof Map<?, ?> data) {
      return Optional.of((Map<String, Object>) data);
    }
    return Optional.empty();
  }

  private static String escapeFilterValue(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
