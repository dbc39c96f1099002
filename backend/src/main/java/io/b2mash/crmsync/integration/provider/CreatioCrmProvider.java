package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.canonical.CanonicalEvent;
import io.b2mash.crmsync.canonical.ContactIdentifier;
import io.b2mash.crmsync.integration.CrmType;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClient.RequestHeadersSpec.ConvertibleClientHttpResponse;

/**
 * Creatio adapter over the OData 4 endpoint at {@code {instance_url}/0/odata}. Credentials: {@code
 * instance_url}, {@code username}, {@code password} (HTTP Basic).
 */
@Component
@CrmAdapter(CrmType.CREATIO)
public class CreatioCrmProvider implements CrmProvider {

  static final String ODATA_PATH = "/0/odata";
  private static final CrmType TYPE = CrmType.CREATIO;

  private final RestClient restClient;

  @Autowired
  public CreatioCrmProvider(CrmHttpClientFactory httpClientFactory) {
    this(httpClientFactory.newBuilder());
  }

  /** Package-private constructor for testing -- allows binding a mock server to the builder. */
  CreatioCrmProvider(RestClient.Builder restClientBuilder) {
    this.restClient = restClientBuilder.build();
  }

  record Connection(String odataUrl, String authorization) {}

  @Override
  public boolean validateCredentials(CrmCredentials credentials) {
    var connection = connect(credentials);
    var uri = CrmHttp.uri(connection.odataUrl(), "/SysSettings", Map.of("$top", 1));
    return CrmHttp.call(
        TYPE,
        "credential validation",
        () ->
            restClient
                .get()
                .uri(uri)
                .headers(headers -> applyHeaders(headers, connection))
                .exchange(
                    (request, response) -> {
                      int status = response.getStatusCode().value();
                      if (status >= 400) {
                        throw error("credential validation", status, response);
                      }
                      return true;
                    }));
  }

  /**
   * Creatio requires a {@code Name} on every contact; when the mapped payload has none it is built
   * from {@code GivenName} and {@code Surname}, falling back to the email.
   */
  @Override
  public RemoteRecord upsertContact(CrmCredentials credentials, Map<String, Object> payload) {
    var email = payload.get("Email");
    if (email == null || email.toString().isBlank()) {
      throw new CrmApiException(TYPE, "Email is required to upsert a Creatio contact");
    }
    var connection = connect(credentials);
    var body = new LinkedHashMap<>(payload);
    body.computeIfAbsent("Name", key -> displayName(payload, email.toString()));

    var existingId = findContactId(connection, "Email", email.toString());
    if (existingId.isPresent()) {
      var contactId = existingId.get();
      var uri = CrmHttp.uri(connection.odataUrl(), "/Contact({id})", contactId);
      int status =
          CrmHttp.call(
              TYPE,
              "contact update",
              () ->
                  restClient
                      .patch()
                      .uri(uri)
                      .headers(headers -> applyHeaders(headers, connection))
                      .contentType(MediaType.APPLICATION_JSON)
                      .body(body)
                      .exchange(
                          (request, response) -> {
                            int code = response.getStatusCode().value();
                            if (code >= 400) {
                              throw error("contact update", code, response);
                            }
                            return code;
                          }));
      var result = new LinkedHashMap<String, Object>();
      result.put("Id", contactId);
      result.put("created", false);
      return new RemoteRecord(status, result);
    }

    var created = createEntity(connection, "Contact", body, "contact create");
    var result = new LinkedHashMap<>(created.body());
    result.put("created", true);
    return new RemoteRecord(created.statusCode(), result);
  }

  /** Records the event as an Activity linked to the contact. */
  @Override
  public RemoteRecord sendEvent(
      CrmCredentials credentials, ContactIdentifier contact, CanonicalEvent event) {
    var connection = connect(credentials);
    var contactId =
        resolveContactId(connection, contact)
            .orElseThrow(() -> new CrmApiException(TYPE, "Creatio contact not found", 404));

    var activity = new LinkedHashMap<String, Object>();
    activity.put("ContactId", contactId);
    activity.put("Title", event.name());
    activity.put("Notes", event.describeProperties());
    activity.put("StartDate", event.timestamp().toString());
    return createEntity(connection, "Activity", activity, "event send");
  }

  @Override
  public Optional<Map<String, Object>> getContact(
      CrmCredentials credentials, ContactIdentifier contact) {
    var connection = connect(credentials);
    if (contact.id() != null) {
      var uri = CrmHttp.uri(connection.odataUrl(), "/Contact({id})", contact.id());
      return CrmHttp.call(
          TYPE,
          "contact lookup",
          () ->
              restClient
                  .get()
                  .uri(uri)
                  .headers(headers -> applyHeaders(headers, connection))
                  .exchange(
                      (request, response) -> {
                        int status = response.getStatusCode().value();
                        if (status == 404) {
                          return Optional.<Map<String, Object>>empty();
                        }
                        if (status >= 400) {
                          throw error("contact lookup", status, response);
                        }
                        return Optional.<Map<String, Object>>of(CrmHttp.readObject(response));
                      }));
    }
    if (contact.email() != null) {
      return searchFirst(connection, "Email", contact.email(), null);
    }
    if (contact.phone() != null) {
      return searchFirst(connection, "MobilePhone", contact.phone(), null);
    }
    throw new CrmApiException(TYPE, "Contact id, email or phone is required");
  }

  private static Connection connect(CrmCredentials credentials) {
    var instanceUrl = CrmHttp.requireHttpsUrl(TYPE, credentials.get("instance_url"));
    var username = credentials.get("username");
    var password = credentials.get("password");
    if (username == null || password == null) {
      throw new CrmAuthenticationException(TYPE, "Creatio username and password are required");
    }
    var authorization =
        "Basic " + HttpHeaders.encodeBasicAuth(username, password, StandardCharsets.UTF_8);
    return new Connection(instanceUrl + ODATA_PATH, authorization);
  }

  private static void applyHeaders(HttpHeaders headers, Connection connection) {
    headers.set(HttpHeaders.AUTHORIZATION, connection.authorization());
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
  }

  private Optional<String> resolveContactId(Connection connection, ContactIdentifier contact) {
    if (contact.id() != null) {
      return Optional.of(contact.id());
    }
    if (contact.email() != null) {
      var byEmail = findContactId(connection, "Email", contact.email());
      if (byEmail.isPresent()) {
        return byEmail;
      }
    }
    if (contact.phone() != null) {
      return findContactId(connection, "MobilePhone", contact.phone());
    }
    return Optional.empty();
  }

  private Optional<String> findContactId(Connection connection, String field, String value) {
    return searchFirst(connection, field, value, "Id")
        .map(found -> found.get("Id"))
        .map(Object::toString);
  }

  private Optional<Map<String, Object>> searchFirst(
      Connection connection, String field, String value, String select) {
    var query = new LinkedHashMap<String, Object>();
    query.put("$filter", field + " eq '" + CrmHttp.odataLiteral(value) + "'");
    if (select != null) {
      query.put("$select", select);
    }
    query.put("$top", 1);
    var uri = CrmHttp.uri(connection.odataUrl(), "/Contact", query);
    return CrmHttp.call(
        TYPE,
        "contact search",
        () ->
            restClient
                .get()
                .uri(uri)
                .headers(headers -> applyHeaders(headers, connection))
                .exchange(
                    (request, response) -> {
                      int status = response.getStatusCode().value();
                      if (status >= 400) {
                        throw error("contact search", status, response);
                      }
                      var matches = CrmHttp.objectList(CrmHttp.readObject(response), "value");
                      return matches.isEmpty()
                          ? Optional.<Map<String, Object>>empty()
                          : Optional.of(matches.get(0));
                    }));
  }

  private RemoteRecord createEntity(
      Connection connection, String entitySet, Map<String, Object> fields, String operation) {
    var uri = CrmHttp.uri(connection.odataUrl(), "/{entitySet}", entitySet);
    return CrmHttp.call(
        TYPE,
        operation,
        () ->
            restClient
                .post()
                .uri(uri)
                .headers(headers -> applyHeaders(headers, connection))
                .contentType(MediaType.APPLICATION_JSON)
                .body(fields)
                .exchange(
                    (request, response) -> {
                      int status = response.getStatusCode().value();
                      if (status >= 400) {
                        throw error(operation, status, response);
                      }
                      return new RemoteRecord(status, CrmHttp.readObject(response));
                    }));
  }

  private static String displayName(Map<String, Object> payload, String email) {
    var parts = new StringBuilder();
    for (String key : new String[] {"GivenName", "Surname"}) {
      var value = payload.get(key);
      if (value != null && !value.toString().isBlank()) {
        if (parts.length() > 0) {
          parts.append(' ');
        }
        parts.append(value.toString().trim());
      }
    }
    return parts.length() > 0 ? parts.toString() : email;
  }

  private static CrmProviderException error(
      String operation, int status, ConvertibleClientHttpResponse response) {
    if (status == 401 || status == 403) {
      return new CrmAuthenticationException(TYPE, "Creatio rejected the username or password");
    }
    return CrmHttp.apiError(TYPE, operation, status, response);
  }
}
