package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.canonical.CanonicalEvent;
import io.b2mash.crmsync.canonical.ContactIdentifier;
import io.b2mash.crmsync.integration.CrmType;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClient.RequestHeadersSpec.ConvertibleClientHttpResponse;

/**
 * Salesforce adapter over the REST API (v60.0).
 *
 * <p>Credentials are either a ready session ({@code access_token} + {@code instance_url}) or the
 * OAuth password grant ({@code client_id}, {@code client_secret}, {@code username}, {@code
 * password}, optional {@code security_token} and {@code domain}, default {@code login}). Tokens
 * obtained through the grant live for one call only.
 */
@Component
@CrmAdapter(CrmType.SALESFORCE)
public class SalesforceCrmProvider implements CrmProvider {

  private static final Logger log = LoggerFactory.getLogger(SalesforceCrmProvider.class);

  static final String API_VERSION = "v60.0";
  private static final String DATA_PATH = "/services/data/" + API_VERSION;
  private static final Pattern LOGIN_DOMAIN = Pattern.compile("[A-Za-z0-9-]+(\\.[A-Za-z0-9-]+)*");
  private static final String CONTACT_SELECT =
      "SELECT Id, Email, FirstName, LastName, Phone, Title";
  private static final CrmType TYPE = CrmType.SALESFORCE;

  private final RestClient restClient;

  @Autowired
  public SalesforceCrmProvider(CrmHttpClientFactory httpClientFactory) {
    this(httpClientFactory.newBuilder());
  }

  /** Package-private constructor for testing -- allows binding a mock server to the builder. */
  SalesforceCrmProvider(RestClient.Builder restClientBuilder) {
    this.restClient = restClientBuilder.build();
  }

  record Session(String accessToken, String instanceUrl) {}

  @Override
  public boolean validateCredentials(CrmCredentials credentials) {
    var session = openSession(credentials);
    return CrmHttp.call(
        TYPE,
        "credential validation",
        () ->
            restClient
                .get()
                .uri(CrmHttp.uri(session.instanceUrl(), DATA_PATH + "/limits"))
                .headers(headers -> headers.setBearerAuth(session.accessToken()))
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
   * Looks the contact up by {@code Email}, then PATCHes it or creates a new one.
   *
   * @return {@code {id, success, created}}
   */
  @Override
  public RemoteRecord upsertContact(CrmCredentials credentials, Map<String, Object> payload) {
    var email = payload.get("Email");
    if (email == null || email.toString().isBlank()) {
      throw new CrmApiException(TYPE, "Email is required to upsert a Salesforce contact");
    }
    var session = openSession(credentials);
    var existingId = findContactId(session, "Email", email.toString());

    if (existingId.isPresent()) {
      var contactId = existingId.get();
      var contactUri =
          CrmHttp.uri(session.instanceUrl(), DATA_PATH + "/sobjects/Contact/{id}", contactId);
      int status =
          CrmHttp.call(
              TYPE,
              "contact update",
              () ->
                  restClient
                      .patch()
                      .uri(contactUri)
                      .headers(headers -> headers.setBearerAuth(session.accessToken()))
                      .contentType(MediaType.APPLICATION_JSON)
                      .body(payload)
                      .exchange(
                          (request, response) -> {
                            int code = response.getStatusCode().value();
                            if (code >= 400) {
                              throw error("contact update", code, response);
                            }
                            return code;
                          }));
      var result = new LinkedHashMap<String, Object>();
      result.put("id", contactId);
      result.put("success", true);
      result.put("created", false);
      return new RemoteRecord(status, result);
    }

    var created = createRecord(session, "Contact", payload, "contact create");
    var result = new LinkedHashMap<>(created.body());
    result.put("created", true);
    log.debug("Created Salesforce contact {}", result.get("id"));
    return new RemoteRecord(created.statusCode(), result);
  }

  /** Records the event as a completed Task linked to the contact. */
  @Override
  public RemoteRecord sendEvent(
      CrmCredentials credentials, ContactIdentifier contact, CanonicalEvent event) {
    var session = openSession(credentials);
    var contactId =
        resolveContactId(session, contact)
            .orElseThrow(() -> new CrmApiException(TYPE, "Salesforce contact not found", 404));

    var task = new LinkedHashMap<String, Object>();
    task.put("WhoId", contactId);
    task.put("Subject", event.name());
    task.put("Description", event.describeProperties());
    task.put("Status", "Completed");
    task.put("Priority", "Normal");
    task.put("ActivityDate", LocalDate.ofInstant(event.timestamp(), ZoneOffset.UTC).toString());
    return createRecord(session, "Task", task, "event send");
  }

  @Override
  public Optional<Map<String, Object>> getContact(
      CrmCredentials credentials, ContactIdentifier contact) {
    var session = openSession(credentials);
    if (contact.id() != null) {
      var contactUri =
          CrmHttp.uri(session.instanceUrl(), DATA_PATH + "/sobjects/Contact/{id}", contact.id());
      return CrmHttp.call(
          TYPE,
          "contact lookup",
          () ->
              restClient
                  .get()
                  .uri(contactUri)
                  .headers(headers -> headers.setBearerAuth(session.accessToken()))
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
      return queryFirst(session, CONTACT_SELECT, "Email", contact.email());
    }
    if (contact.phone() != null) {
      return queryFirst(session, CONTACT_SELECT, "Phone", contact.phone());
    }
    throw new CrmApiException(TYPE, "Contact id, email or phone is required");
  }

  /** Uses the supplied session or runs the OAuth password grant. */
  Session openSession(CrmCredentials credentials) {
    if (credentials.has("access_token") && credentials.has("instance_url")) {
      return new Session(
          credentials.get("access_token"),
          CrmHttp.requireHttpsUrl(TYPE, credentials.get("instance_url")));
    }
    for (String key : new String[] {"client_id", "client_secret", "username", "password"}) {
      if (!credentials.has(key)) {
        throw new CrmAuthenticationException(
            TYPE,
            "Missing credentials. Provide access_token and instance_url, "
                + "or client_id, client_secret, username and password");
      }
    }
    var domain = credentials.has("domain") ? credentials.get("domain") : "login";
    if (!LOGIN_DOMAIN.matcher(domain).matches()) {
      throw new CrmAuthenticationException(TYPE, "Invalid Salesforce login domain");
    }
    var securityToken = credentials.has("security_token") ? credentials.get("security_token") : "";

    var form = new LinkedMultiValueMap<String, String>();
    form.add("grant_type", "password");
    form.add("client_id", credentials.get("client_id"));
    form.add("client_secret", credentials.get("client_secret"));
    form.add("username", credentials.get("username"));
    form.add("password", credentials.get("password") + securityToken);

    var tokenUri = CrmHttp.uri("https://" + domain + ".salesforce.com", "/services/oauth2/token");
    var token =
        CrmHttp.call(
            TYPE,
            "authentication",
            () ->
                restClient
                    .post()
                    .uri(tokenUri)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .exchange(
                        (request, response) -> {
                          int status = response.getStatusCode().value();
                          if (status == 400 || status == 401) {
                            throw new CrmAuthenticationException(
                                TYPE,
                                "Salesforce authentication failed: " + CrmHttp.readText(response));
                          }
                          if (status >= 400) {
                            throw CrmHttp.apiError(TYPE, "authentication", status, response);
                          }
                          return CrmHttp.readObject(response);
                        }));

    var accessToken = token.get("access_token");
    var instanceUrl = token.get("instance_url");
    if (accessToken == null || instanceUrl == null) {
      throw new CrmApiException(
          TYPE, "Salesforce token response is missing access_token or instance_url");
    }
    return new Session(
        accessToken.toString(), CrmHttp.requireHttpsUrl(TYPE, instanceUrl.toString()));
  }

  private Optional<String> resolveContactId(Session session, ContactIdentifier contact) {
    if (contact.id() != null) {
      return Optional.of(contact.id());
    }
    if (contact.email() != null) {
      var byEmail = findContactId(session, "Email", contact.email());
      if (byEmail.isPresent()) {
        return byEmail;
      }
    }
    if (contact.phone() != null) {
      return findContactId(session, "Phone", contact.phone());
    }
    return Optional.empty();
  }

  private Optional<String> findContactId(Session session, String field, String value) {
    return queryFirst(session, "SELECT Id", field, value)
        .map(found -> found.get("Id"))
        .map(Object::toString);
  }

  private Optional<Map<String, Object>> queryFirst(
      Session session, String select, String field, String value) {
    var soql =
        select
            + " FROM Contact WHERE "
            + field
            + " = '"
            + CrmHttp.soqlLiteral(value)
            + "' LIMIT 1";
    return CrmHttp.call(
        TYPE,
        "contact search",
        () ->
            restClient
                .get()
                .uri(CrmHttp.uri(session.instanceUrl(), DATA_PATH + "/query", Map.of("q", soql)))
                .headers(headers -> headers.setBearerAuth(session.accessToken()))
                .exchange(
                    (request, response) -> {
                      int status = response.getStatusCode().value();
                      if (status >= 400) {
                        throw error("contact search", status, response);
                      }
                      var records = CrmHttp.objectList(CrmHttp.readObject(response), "records");
                      return records.isEmpty()
                          ? Optional.<Map<String, Object>>empty()
                          : Optional.of(records.get(0));
                    }));
  }

  private RemoteRecord createRecord(
      Session session, String sobject, Map<String, Object> fields, String operation) {
    return CrmHttp.call(
        TYPE,
        operation,
        () ->
            restClient
                .post()
                .uri(CrmHttp.uri(session.instanceUrl(), DATA_PATH + "/sobjects/{type}", sobject))
                .headers(headers -> headers.setBearerAuth(session.accessToken()))
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

  private static CrmProviderException error(
      String operation, int status, ConvertibleClientHttpResponse response) {
    if (status == 401) {
      return new CrmAuthenticationException(TYPE, "Salesforce session is invalid or expired");
    }
    return CrmHttp.apiError(TYPE, operation, status, response);
  }
}
