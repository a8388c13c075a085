package com.openfashion.vaultservice.client.registry.dto;

public record NewSubscriptionNotice(
        String destination,
        String vaultId,
        Long subscriptionId,
        String externalId
) {}
