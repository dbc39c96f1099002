package io.b2mash.crmsync.integration.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.b2mash.crmsync.canonical.CanonicalEvent;
import io.b2mash.crmsync.canonical.ContactIdentifier;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class SalesforceCrmProviderTest {

  private static final String INSTANCE = "https://acme.my.salesforce.com";
  private static final String DATA = INSTANCE + "/services/data/v60.0";

  private final CrmCredentials session =
      CrmCredentials.of(Map.of("access_token", "00Dtoken", "instance_url", INSTANCE + "/"));

  private MockRestServiceServer server;
  private SalesforceCrmProvider provider;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    provider = new SalesforceCrmProvider(builder);
  }

  private void expectQuery(String responseJson) {
    server
        .expect(requestTo(startsWith(DATA + "/query?q=")))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header("Authorization", "Bearer 00Dtoken"))
        .andRespond(withSuccess(responseJson, MediaType.APPLICATION_JSON));
  }

  @Test
  void validateCredentials_with_session_calls_limits() {
    server
        .expect(requestTo(DATA + "/limits"))
        .andExpect(header("Authorization", "Bearer 00Dtoken"))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    assertThat(provider.validateCredentials(session)).isTrue();
    server.verify();
  }

  @Test
  void password_grant_appends_security_token_and_uses_returned_instance() {
    server
        .expect(requestTo("https://test.salesforce.com/services/oauth2/token"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(content().string(containsString("grant_type=password")))
        .andExpect(content().string(containsString("password=secretTOKEN")))
        .andRespond(
            withSuccess(
                "{\"access_token\": \"00Dtoken\", \"instance_url\": \"" + INSTANCE + "\"}",
                MediaType.APPLICATION_JSON));
    server
        .expect(requestTo(DATA + "/limits"))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    var credentials =
        CrmCredentials.of(
            Map.of(
                "client_id", "cid",
                "client_secret", "csecret",
                "username", "ops@acme.com",
                "password", "secret",
                "security_token", "TOKEN",
                "domain", "test"));

    assertThat(provider.validateCredentials(credentials)).isTrue();
    server.verify();
  }

  @Test
  void rejected_password_grant_is_authentication_error() {
    server
        .expect(requestTo("https://login.salesforce.com/services/oauth2/token"))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\": \"invalid_grant\"}"));

    var credentials =
        CrmCredentials.of(
            Map.of(
                "client_id", "cid",
                "client_secret", "csecret",
                "username", "ops@acme.com",
                "password", "wrong"));

    assertThatThrownBy(() -> provider.validateCredentials(credentials))
        .isInstanceOf(CrmAuthenticationException.class)
        .hasMessageContaining("invalid_grant");
  }

  @Test
  void incomplete_credentials_fail_without_remote_call() {
    assertThatThrownBy(
            () -> provider.validateCredentials(CrmCredentials.of(Map.of("username", "ops"))))
        .isInstanceOf(CrmAuthenticationException.class)
        .hasMessageContaining("Missing credentials");
    server.verify();
  }

  @Test
  void non_https_instance_url_is_rejected() {
    var insecure =
        CrmCredentials.of(
            Map.of("access_token", "00Dtoken", "instance_url", "http://acme.salesforce.com"));

    assertThatThrownBy(() -> provider.validateCredentials(insecure))
        .isInstanceOf(CrmAuthenticationException.class)
        .hasMessage("instance_url must be an https URL");
  }

  @Test
  void upsertContact_updates_existing_contact() {
    expectQuery("{\"totalSize\": 1, \"records\": [{\"Id\": \"003EXISTING\"}]}");
    server
        .expect(requestTo(DATA + "/sobjects/Contact/003EXISTING"))
        .andExpect(method(HttpMethod.PATCH))
        .andExpect(jsonPath("$.LastName").value("Lovelace"))
        .andRespond(withStatus(HttpStatus.NO_CONTENT));

    var result =
        provider.upsertContact(session, Map.of("Email", "ada@example.com", "LastName", "Lovelace"));

    assertThat(result.statusCode()).isEqualTo(204);
    assertThat(result.body())
        .containsEntry("id", "003EXISTING")
        .containsEntry("success", true)
        .containsEntry("created", false);
    server.verify();
  }

  @Test
  void upsertContact_creates_missing_contact() {
    expectQuery("{\"totalSize\": 0, \"records\": []}");
    server
        .expect(requestTo(DATA + "/sobjects/Contact"))
        .andExpect(method(HttpMethod.POST))
        .andRespond(
            withStatus(HttpStatus.CREATED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"id\": \"003NEW\", \"success\": true, \"errors\": []}"));

    var result =
        provider.upsertContact(session, Map.of("Email", "ada@example.com", "LastName", "Lovelace"));

    assertThat(result.statusCode()).isEqualTo(201);
    assertThat(result.body()).containsEntry("id", "003NEW").containsEntry("created", true);
    server.verify();
  }

  @Test
  void soql_literal_is_escaped() {
    server
        .expect(requestTo(containsString("%27o%5C%27brien%40example.com%27")))
        .andRespond(withSuccess("{\"records\": []}", MediaType.APPLICATION_JSON));

    assertThat(provider.getContact(session, ContactIdentifier.ofEmail("o'brien@example.com")))
        .isEmpty();
    server.verify();
  }

  @Test
  void upsertContact_without_email_is_rejected() {
    assertThatThrownBy(() -> provider.upsertContact(session, Map.of("LastName", "Lovelace")))
        .isInstanceOf(CrmApiException.class)
        .hasMessageContaining("Email is required");
  }

  @Test
  void sendEvent_creates_completed_task_for_contact() {
    expectQuery("{\"records\": [{\"Id\": \"003ADA\"}]}");
    server
        .expect(requestTo(DATA + "/sobjects/Task"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(jsonPath("$.WhoId").value("003ADA"))
        .andExpect(jsonPath("$.Subject").value("Demo Booked"))
        .andExpect(jsonPath("$.Description").value("source: webinar"))
        .andExpect(jsonPath("$.Status").value("Completed"))
        .andExpect(jsonPath("$.ActivityDate").value("2026-03-15"))
        .andRespond(
            withStatus(HttpStatus.CREATED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"id\": \"00TTASK\", \"success\": true}"));

    var event =
        new CanonicalEvent(
            "Demo Booked",
            Map.of("source", "webinar"),
            Instant.parse("2026-03-15T23:30:00Z"),
            null);

    var result = provider.sendEvent(session, ContactIdentifier.ofEmail("ada@example.com"), event);

    assertThat(result.body()).containsEntry("id", "00TTASK");
    server.verify();
  }

  @Test
  void sendEvent_for_unknown_contact_is_not_found() {
    expectQuery("{\"records\": []}");

    var event = CanonicalEvent.named("Demo Booked", Map.of());

    assertThatThrownBy(
            () -> provider.sendEvent(session, ContactIdentifier.ofEmail("nobody@x.com"), event))
        .isInstanceOf(CrmApiException.class)
        .extracting("statusCode")
        .isEqualTo(404);
  }

  @Test
  void expired_session_is_authentication_error() {
    server
        .expect(requestTo(DATA + "/limits"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThatThrownBy(() -> provider.validateCredentials(session))
        .isInstanceOf(CrmAuthenticationException.class)
        .hasMessage("Salesforce session is invalid or expired");
  }
}
