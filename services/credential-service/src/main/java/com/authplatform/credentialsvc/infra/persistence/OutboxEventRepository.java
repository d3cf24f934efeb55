package com.authplatform.credentialsvc.infra.persistence;

import com.authplatform.credentialsvc.domain.model.OutboxEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, UUID> {

    @Query("SELECT e FROM OutboxEvent e WHERE e.dispatchedAt IS NULL AND e.retryCount < :maxRetries ORDER BY e.createdAt ASC")
    List<OutboxEvent> findDispatchable(@Param("maxRetries") int maxRetries, Pageable page);

    List<OutboxEvent> findByAggregateIdAndEventType(UUID aggregateId, String eventType);

    long countByDispatchedAtIsNull();
}
