package com.openfashion.vaultservice.gateway;

import com.openfashion.vaultservice.dto.call.OwnerCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.core.serializer.support.SerializationFailedException;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

@Component
@RequiredArgsConstructor
public class OwnerCommandCodec {

    private final ObjectMapper objectMapper;

    public byte[] encode(OwnerCommand command) {
        try {
            return objectMapper.writeValueAsBytes(command);
        } catch (JacksonException e) {
            throw new SerializationFailedException("Failed to encode owner command " + command.type(), e);
        }
    }

    public OwnerCommand decode(byte[] payload) {
        return objectMapper.readValue(payload, OwnerCommand.class);
    }
}
