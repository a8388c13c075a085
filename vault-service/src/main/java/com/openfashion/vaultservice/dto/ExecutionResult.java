package com.openfashion.vaultservice.dto;

public record ExecutionResult(
        Long id,
        boolean success
) {}
