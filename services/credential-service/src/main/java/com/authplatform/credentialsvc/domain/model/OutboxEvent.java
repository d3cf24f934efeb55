package com.authplatform.credentialsvc.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Notification request written in the same transaction as the credential change that caused it.
 * A row is pending until the dispatcher hands it to Kafka; failed sends stay pending and count
 * toward the retry ceiling.
 */
@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent {

    static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, length = 50)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false)
    private UUID aggregateId;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Column(name = "payload_json", nullable = false)
    private String payloadJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant dispatchedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    public static OutboxEvent pending(String aggregateType, UUID aggregateId, String eventType,
                                      String payloadJson, Instant createdAt) {
        OutboxEvent event = new OutboxEvent();
        event.aggregateType = aggregateType;
        event.aggregateId = aggregateId;
        event.eventType = eventType;
        event.payloadJson = payloadJson;
        event.createdAt = createdAt;
        return event;
    }

    public boolean isDispatched() {
        return dispatchedAt != null;
    }

    public boolean hasExhaustedRetries(int maxRetries) {
        return !isDispatched() && retryCount >= maxRetries;
    }

    public void markDispatched(Instant when) {
        this.dispatchedAt = when;
        this.lastError = null;
    }

    public void recordDispatchFailure(String error) {
        this.retryCount++;
        this.lastError = error != null && error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH)
                : error;
    }
}
