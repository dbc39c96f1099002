package io.b2mash.crmsync.sync;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncLogRepository extends JpaRepository<SyncLog, UUID> {

  Page<SyncLog> findByIntegrationId(UUID integrationId, Pageable pageable);

  List<SyncLog> findByIntegrationIdOrderByCreatedAtAsc(UUID integrationId);
}
