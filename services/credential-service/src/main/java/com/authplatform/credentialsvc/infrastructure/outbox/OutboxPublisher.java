package com.authplatform.credentialsvc.infrastructure.outbox;

import com.authplatform.credentialsvc.domain.model.OutboxEvent;
import com.authplatform.credentialsvc.infra.persistence.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Writes domain events to the outbox table inside the caller's transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxEventRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent publish(String aggregateType, UUID aggregateId, String eventType, Map<String, String> payload) {
        String payloadJson;
        try {
            payloadJson = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize outbox payload for " + eventType, e);
        }

        OutboxEvent saved = outboxRepository.save(
                OutboxEvent.pending(aggregateType, aggregateId, eventType, payloadJson, clock.instant()));
        log.debug("Published outbox event: type={}, aggregateId={}", eventType, aggregateId);
        return saved;
    }
}
