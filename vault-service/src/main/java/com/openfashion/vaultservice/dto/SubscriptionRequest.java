package com.openfashion.vaultservice.dto;

import com.openfashion.vaultservice.model.SettlementVariant;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.List;

public record SubscriptionRequest(
        @NotBlank(message = "Destination is required") String destination,
        @NotBlank(message = "Recipient is required") String recipient,
        @NotNull @Positive(message = "Value must be greater than zero")
        @Digits(integer = 15, fraction = 4, message = "At most 4 decimal places are allowed") BigDecimal value,
        @Positive(message = "Period must be greater than zero") long periodSeconds,
        @NotNull(message = "Settlement variant is required") SettlementVariant variant,
        byte[] payload,
        @NotNull(message = "Metadata is required") List<String> metadata,
        @PositiveOrZero @Digits(integer = 15, fraction = 4, message = "At most 4 decimal places are allowed") BigDecimal attachedValue
) {}
