package io.b2mash.crmsync.integration;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CrmIntegrationRepository extends JpaRepository<CrmIntegration, UUID> {

  Optional<CrmIntegration> findByOwnerIdAndCrmType(UUID ownerId, CrmType crmType);

  List<CrmIntegration> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

  List<CrmIntegration> findByOwnerIdAndActiveTrueOrderByCreatedAtAsc(UUID ownerId);

  List<CrmIntegration> findByOwnerIdAndActiveTrueAndCrmTypeInOrderByCreatedAtAsc(
      UUID ownerId, Collection<CrmType> crmTypes);
}
