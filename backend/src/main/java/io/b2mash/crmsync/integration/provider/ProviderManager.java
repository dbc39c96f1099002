package io.b2mash.crmsync.integration.provider;

import io.b2mash.crmsync.canonical.CanonicalContact;
import io.b2mash.crmsync.canonical.CanonicalEvent;
import io.b2mash.crmsync.canonical.ContactIdentifier;
import io.b2mash.crmsync.integration.CrmType;
import io.b2mash.crmsync.integration.mapping.FieldMappingService;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;

/**
 * Single entry point to the CRM adapters. Adapters are discovered once at startup from beans
 * annotated with {@link CrmAdapter}; the resulting table never changes afterwards.
 */
@Component
public class ProviderManager {

  private static final Logger log = LoggerFactory.getLogger(ProviderManager.class);

  // Built at startup: CRM type -> adapter bean
  private final Map<CrmType, CrmProvider> providers = new EnumMap<>(CrmType.class);

  private final FieldMappingService fieldMappingService;

  public ProviderManager(
      ApplicationContext applicationContext, FieldMappingService fieldMappingService) {
    this.fieldMappingService = fieldMappingService;

    // Fail fast if two adapters claim the same CRM type.
    applicationContext
        .getBeansWithAnnotation(CrmAdapter.class)
        .forEach(
            (name, bean) -> {
              var annotation = AnnotationUtils.findAnnotation(bean.getClass(), CrmAdapter.class);
              if (annotation == null || !(bean instanceof CrmProvider provider)) {
                throw new IllegalStateException(
                    "Bean " + name + " is a @CrmAdapter but does not implement CrmProvider");
              }
              var existing = providers.putIfAbsent(annotation.value(), provider);
              if (existing != null) {
                throw new IllegalStateException(
                    "Duplicate @CrmAdapter for "
                        + annotation.value().slug()
                        + " registered by both "
                        + existing.getClass().getName()
                        + " and "
                        + bean.getClass().getName());
              }
            });
    log.info("Registered CRM adapters: {}", providers.keySet());
  }

  /**
   * @throws UnsupportedCrmTypeException if no adapter is bound to the type
   */
  public CrmProvider get(CrmType crmType) {
    var provider = providers.get(crmType);
    if (provider == null) {
      throw new UnsupportedCrmTypeException(crmType.slug());
    }
    return provider;
  }

  public boolean isSupported(CrmType crmType) {
    return providers.containsKey(crmType);
  }

  /** CRM types that can be connected, in declaration order. */
  public List<CrmType> connectableTypes() {
    return List.copyOf(providers.keySet());
  }

  public boolean validateCredentials(CrmType crmType, CrmCredentials credentials) {
    var provider = get(crmType);
    if (credentials.isEmpty()) {
      throw new CrmAuthenticationException(crmType, "Credentials are required");
    }
    return provider.validateCredentials(credentials);
  }

  /** Maps the canonical contact to the CRM's payload shape and upserts it. */
  public RemoteRecord upsertContact(
      CrmType crmType, CrmCredentials credentials, CanonicalContact contact) {
    var provider = get(crmType);
    var payload = fieldMappingService.transformContact(contact, crmType);
    return provider.upsertContact(credentials, payload);
  }

  public RemoteRecord sendEvent(
      CrmType crmType,
      CrmCredentials credentials,
      ContactIdentifier contact,
      CanonicalEvent event) {
    return get(crmType).sendEvent(credentials, contact, event);
  }

  public Optional<Map<String, Object>> getContact(
      CrmType crmType, CrmCredentials credentials, ContactIdentifier contact) {
    return get(crmType).getContact(credentials, contact);
  }

  /**
   * Upserts the contact into every target in order. A failing target is reported in its own
   * outcome and does not affect the others.
   */
  public Map<String, TargetOutcome> syncContactToTargets(
      List<CrmTarget> targets, CanonicalContact contact) {
    var results = new LinkedHashMap<String, TargetOutcome>();
    for (var target : targets) {
      results.put(
          target.crmType().slug(),
          TargetOutcome.execute(
              target.crmType(),
              () -> upsertContact(target.crmType(), target.credentials(), contact)));
    }
    return results;
  }

  /** Event counterpart of {@link #syncContactToTargets}. */
  public Map<String, TargetOutcome> sendEventToTargets(
      List<CrmTarget> targets, ContactIdentifier contact, CanonicalEvent event) {
    var results = new LinkedHashMap<String, TargetOutcome>();
    for (var target : targets) {
      results.put(
          target.crmType().slug(),
          TargetOutcome.execute(
              target.crmType(),
              () -> sendEvent(target.crmType(), target.credentials(), contact, event)));
    }
    return results;
  }
}
