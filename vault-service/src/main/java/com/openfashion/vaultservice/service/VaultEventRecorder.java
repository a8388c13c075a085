package com.openfashion.vaultservice.service;

import com.openfashion.vaultservice.dto.event.VaultEventPayload;
import com.openfashion.vaultservice.model.OutboxStatus;
import com.openfashion.vaultservice.model.VaultEvent;
import com.openfashion.vaultservice.model.VaultEventType;
import com.openfashion.vaultservice.repository.VaultEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.serializer.support.SerializationFailedException;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;

/**
 * Appends to the event stream in the same database transaction as the state change it
 * describes. {@code OutboxPoller} relays pending rows to Kafka afterwards.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VaultEventRecorder {

    private final VaultEventRepository eventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public VaultEvent record(VaultEventType type, Object aggregateId, VaultEventPayload payload) {
        try {
            String jsonPayload = objectMapper.writeValueAsString(payload);

            VaultEvent event = VaultEvent.builder()
                    .type(type)
                    .aggregateId(String.valueOf(aggregateId))
                    .payload(jsonPayload)
                    .status(OutboxStatus.PENDING)
                    .createdAt(clock.instant())
                    .build();

            return eventRepository.save(event);
        } catch (JacksonException e) {
            log.error("Failed to serialize {} event for {}", type, aggregateId, e);
            throw new SerializationFailedException("Serialization failure", e);
        }
    }
}
