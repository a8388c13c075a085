package com.openfashion.vaultservice.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record TransactionRequest(
        @NotBlank(message = "Destination is required") String destination,
        @NotNull(message = "Value is required") @PositiveOrZero @Digits(integer = 15, fraction = 4, message = "At most 4 decimal places are allowed") BigDecimal value,
        byte[] payload
) {}
