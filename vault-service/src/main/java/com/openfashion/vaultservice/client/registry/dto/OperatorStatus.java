package com.openfashion.vaultservice.client.registry.dto;

public record OperatorStatus(
        String account,
        boolean operator
) {}
