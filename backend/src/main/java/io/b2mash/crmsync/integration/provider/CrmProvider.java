package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.canonical.CanonicalEvent;
import io.b2mash.crmsync.canonical.ContactIdentifier;
import java.util.Map;
import java.util.Optional;

/**
 * Port implemented by every CRM adapter. Implementations are stateless: credentials arrive with
 * each call and nothing is cached between calls. Every method either returns a result or throws
 * {@link CrmAuthenticationException} / {@link CrmApiException}.
 *
 * @see CrmAdapter
 */
public interface CrmProvider {

  /**
   * Lightweight authenticated probe against the CRM.
   *
   * @return true when the credentials work
   * @throws CrmAuthenticationException when the credentials are missing or rejected
   */
  boolean validateCredentials(CrmCredentials credentials);

  /**
   * Creates the contact or updates the existing one matching its email.
   *
   * @param payload output of the field mapping engine for this CRM
   */
  RemoteRecord upsertContact(CrmCredentials credentials, Map<String, Object> payload);

  /** Records the event against the identified contact. */
  RemoteRecord sendEvent(
      CrmCredentials credentials, ContactIdentifier contact, CanonicalEvent event);

  /** Looks the contact up by native id, then email, then phone. Empty when not found. */
  Optional<Map<String, Object>> getContact(CrmCredentials credentials, ContactIdentifier contact);
}
