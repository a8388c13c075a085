package com.openfashion.vaultservice.scheduler;

import com.openfashion.vaultservice.model.OutboxStatus;
import com.openfashion.vaultservice.model.VaultEvent;
import com.openfashion.vaultservice.repository.VaultEventRepository;
import jakarta.transaction.Transactional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
@Slf4j
@RequiredArgsConstructor
public class OutboxPoller {

    private final VaultEventRepository eventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private static final int DELAY = 2000;
    private static final int LIMIT = 100;

    @Scheduled(fixedDelay = DELAY)
    @Transactional
    public void processOutboxEvent() {
        List<VaultEvent> events = eventRepository.findTopForProcessing(LIMIT);

        if (events.isEmpty()) return;

        log.info("Polling outbox: found {} vault events to publish", events.size());

        for (VaultEvent event : events) {
            String topic = event.getType().getTopic();
            try {
                kafkaTemplate.send(topic, event.getAggregateId(), event.getPayload())
                        .get(3, TimeUnit.SECONDS);

                event.setStatus(OutboxStatus.PROCESSED);
                eventRepository.save(event);

                log.debug("Published event {} ({}) to topic {}", event.getId(), event.getType(), topic);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Thread was interrupted while sending event {}", event.getId());
                return;
            } catch (ExecutionException e) {
                log.error("Failed to publish vault event {}: {}", event.getId(), e.getCause().getMessage());
            } catch (TimeoutException e) {
                log.error("Timed out publishing vault event {} to {}", event.getId(), topic);
            } catch (Exception e) {
                log.error("Unexpected error processing event {}: {}", event.getId(), e.getMessage());
            }
        }
    }
}
