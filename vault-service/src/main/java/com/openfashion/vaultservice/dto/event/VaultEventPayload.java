package com.openfashion.vaultservice.dto.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.math.BigDecimal;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VaultEventPayload(
        String actor,
        Long transactionId,
        Long subscriptionId,
        String owner,
        String destination,
        BigDecimal value,
        Integer required,
        Long cycle,
        Boolean firstCycle,
        String reason
) {}
