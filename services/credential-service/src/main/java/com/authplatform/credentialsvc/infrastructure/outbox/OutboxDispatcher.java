package com.authplatform.credentialsvc.infrastructure.outbox;

import com.authplatform.credentialsvc.domain.model.OutboxEvent;
import com.authplatform.credentialsvc.infra.persistence.OutboxEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls the outbox and hands events to Kafka on a bounded worker pool.
 * A failed send is recorded on the event and retried on a later poll until the retry budget runs out;
 * it never reaches the request that produced the event.
 */
@Component
@Slf4j
public class OutboxDispatcher {

    public static final String TOPIC_PREFIX = "credential-service.";

    private final OutboxEventRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AsyncTaskExecutor executor;
    private final Clock clock;
    private final int batchSize;
    private final int maxRetries;
    private final long sendTimeoutMs;

    public OutboxDispatcher(
            OutboxEventRepository outboxRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            @Qualifier("outboxExecutor") AsyncTaskExecutor executor,
            Clock clock,
            @Value("${app.outbox.batch-size:100}") int batchSize,
            @Value("${app.outbox.max-retries:5}") int maxRetries,
            @Value("${app.outbox.send-timeout-ms:5000}") long sendTimeoutMs) {
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.executor = executor;
        this.clock = clock;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    /**
     * Dispatches one batch and waits for it, so the next poll never picks up an event still in flight.
     *
     * @return number of events delivered in this batch
     */
    @Scheduled(fixedDelayString = "${app.outbox.poll-interval-ms:1000}")
    public int dispatchEvents() {
        List<OutboxEvent> events = outboxRepository.findDispatchable(maxRetries, PageRequest.of(0, batchSize));
        if (events.isEmpty()) {
            return 0;
        }

        log.debug("Dispatching {} outbox events", events.size());

        List<CompletableFuture<Boolean>> inFlight = new ArrayList<>(events.size());
        for (OutboxEvent event : events) {
            inFlight.add(executor.submitCompletable(() -> processEvent(event)));
        }
        CompletableFuture.allOf(inFlight.toArray(CompletableFuture[]::new)).join();

        return (int) inFlight.stream().filter(CompletableFuture::join).count();
    }

    static String topicFor(String eventType) {
        return TOPIC_PREFIX + eventType.replaceAll("([a-z0-9])([A-Z])", "$1-$2")
                .replace('_', '-')
                .toLowerCase();
    }

    private boolean processEvent(OutboxEvent event) {
        String topic = topicFor(event.getEventType());
        try {
            kafkaTemplate.send(topic, event.getAggregateId().toString(), event.getPayloadJson())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            event.markDispatched(clock.instant());
            outboxRepository.save(event);
            log.debug("Event sent to Kafka: eventId={}, topic={}", event.getId(), topic);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markFailed(event, "interrupted");
            return false;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            log.error("Failed to send event to Kafka: eventId={}, type={}, attempt={}, error={}",
                    event.getId(), event.getEventType(), event.getRetryCount() + 1, cause.getMessage());
            markFailed(event, cause.getMessage());
            return false;
        }
    }

    private void markFailed(OutboxEvent event, String error) {
        event.recordDispatchFailure(error);
        outboxRepository.save(event);
        if (event.hasExhaustedRetries(maxRetries)) {
            log.error("Outbox event exhausted retries and will not be dispatched again: eventId={}, type={}",
                    event.getId(), event.getEventType());
        }
    }
}
