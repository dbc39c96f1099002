package io.b2mash.crmsync.canonical;

import java.util.Locale;

/**
 * Identifies a contact in a remote CRM. At least one of native id, email or phone should be set;
 * adapters resolve a missing native id through email, then phone.
 */
public record ContactIdentifier(String id, String email, String phone) {

  public ContactIdentifier {
    id = blankToNull(id);
    email = blankToNull(email);
    email = email == null ? null : email.toLowerCase(Locale.ROOT);
    phone = blankToNull(phone);
  }

  public static ContactIdentifier ofId(String id) {
    return new ContactIdentifier(id, null, null);
  }

  public static ContactIdentifier ofEmail(String email) {
    return new ContactIdentifier(null, email, null);
  }

  public boolean hasAny() {
    return id != null || email != null || phone != null;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
