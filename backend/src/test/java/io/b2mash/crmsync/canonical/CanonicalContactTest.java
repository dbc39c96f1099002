package io.b2mash.crmsync.canonical;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class CanonicalContactTest {

  private static ValidatorFactory validatorFactory;
  private static Validator validator;

  @BeforeAll
  static void createValidator() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
    validator = validatorFactory.getValidator();
  }

  @AfterAll
  static void closeValidator() {
    validatorFactory.close();
  }

  @Test
  void email_is_trimmed_and_lowercased() {
    var contact = CanonicalContact.builder("  Jane.Doe@Example.COM ").build();

    assertThat(contact.email()).isEqualTo("jane.doe@example.com");
  }

  @Test
  void custom_properties_are_copied_from_caller() {
    var custom = new HashMap<String, Object>();
    custom.put("plan", "pro");
    var contact =
        new CanonicalContact(
            "a@b.com", null, null, null, null, null, null, null, null, null, null, null, null,
            null, null, null, custom);

    custom.put("plan", "free");

    assertThat(contact.customProperties()).containsEntry("plan", "pro");
    assertThatThrownBy(() -> contact.customProperties().put("x", 1))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void selectFields_keeps_email_and_custom_properties() {
    var contact =
        CanonicalContact.builder("a@b.com")
            .firstName("Ada")
            .lastName("Lovelace")
            .company("Engines Ltd")
            .customProperty("tier", "gold")
            .build();

    var selected = contact.selectFields(List.of("first_name"));

    assertThat(selected.email()).isEqualTo("a@b.com");
    assertThat(selected.firstName()).isEqualTo("Ada");
    assertThat(selected.lastName()).isNull();
    assertThat(selected.company()).isNull();
    assertThat(selected.customProperties()).containsEntry("tier", "gold");
  }

  @Test
  void selectFields_with_empty_selection_returns_same_contact() {
    var contact = CanonicalContact.builder("a@b.com").firstName("Ada").build();

    assertThat(contact.selectFields(List.of())).isSameAs(contact);
    assertThat(contact.selectFields(null)).isSameAs(contact);
  }

  @Test
  void builder_rejects_unknown_field() {
    assertThatThrownBy(() -> CanonicalContact.builder("a@b.com").field("nickname", "x"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("nickname");
  }

  @Test
  void namedFields_follows_canonical_order() {
    var contact = CanonicalContact.builder("a@b.com").build();

    assertThat(contact.namedFields().keySet())
        .containsExactlyElementsOf(CanonicalContact.FIELD_NAMES);
  }

  @Test
  void contactIdentifier_normalizes_blank_values() {
    var identifier = new ContactIdentifier(" ", " Jane@Example.com ", "");

    assertThat(identifier.id()).isNull();
    assertThat(identifier.email()).isEqualTo("jane@example.com");
    assertThat(identifier.phone()).isNull();
    assertThat(identifier.hasAny()).isTrue();
    assertThat(new ContactIdentifier(null, "", " ").hasAny()).isFalse();
  }

  @Test
  void event_describeProperties_renders_one_pair_per_line() {
    var properties = new LinkedHashMap<String, Object>();
    properties.put("plan", "pro");
    properties.put("seats", 5);

    var event = CanonicalEvent.named("Upgraded", properties);

    assertThat(event.timestamp()).isNotNull();
    assertThat(event.describeProperties()).isEqualTo("plan: pro\nseats: 5");
  }

  // --- Validation ---

  @Test
  void oversized_standard_fields_are_rejected() {
    var contact =
        CanonicalContact.builder("a@b.com")
            .firstName("x".repeat(101))
            .phone("1".repeat(21))
            .field("language", "en-GB-oxendict")
            .build();

    assertThat(validator.validate(contact))
        .extracting(violation -> violation.getPropertyPath().toString())
        .containsExactlyInAnyOrder("firstName", "phone", "language");
  }

  @Test
  void fields_at_their_limits_are_accepted() {
    var contact =
        CanonicalContact.builder("a@b.com")
            .firstName("x".repeat(100))
            .phone("1".repeat(20))
            .field("street_address", "s".repeat(255))
            .field("timezone", "t".repeat(50))
            .build();

    assertThat(validator.validate(contact)).isEmpty();
  }
}
