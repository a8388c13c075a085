package com.openfashion.vaultservice.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record DepositRequest(
        @NotNull @Positive(message = "Deposit must be greater than zero") @Digits(integer = 15, fraction = 4, message = "At most 4 decimal places are allowed") BigDecimal value
) {}
