package com.openfashion.vaultservice.client.registry.dto;

public record PaymentNotice(
        String destination,
        Long subscriptionId,
        String externalId,
        boolean firstCycle
) {}
