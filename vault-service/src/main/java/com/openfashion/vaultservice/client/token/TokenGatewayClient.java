package com.openfashion.vaultservice.client.token;

import com.openfashion.vaultservice.dto.call.TokenTransferCommand;
import com.openfashion.vaultservice.gateway.ExternalCallGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;

// Token contracts are principals like any other, reached through the call gateway with no value attached
@Component
@Slf4j
@RequiredArgsConstructor
public class TokenGatewayClient implements TokenCollaborator {

    private final ExternalCallGateway externalCallGateway;
    private final ObjectMapper objectMapper;

    @Override
    public boolean transferOnBehalf(String token, String from, String to, BigDecimal value) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(TokenTransferCommand.transferOnBehalf(from, to, value));
        } catch (JacksonException e) {
            log.error("Failed to encode transfer of {} on token {}", value, token, e);
            return false;
        }

        boolean accepted = externalCallGateway.call(token, BigDecimal.ZERO, payload);
        if (!accepted) {
            log.warn("Token {} refused transfer of {} from {} to {}", token, value, from, to);
        }
        return accepted;
    }
}
