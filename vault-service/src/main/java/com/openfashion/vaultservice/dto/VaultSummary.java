package com.openfashion.vaultservice.dto;

import java.math.BigDecimal;
import java.util.List;

public record VaultSummary(
        String address,
        List<String> owners,
        int required,
        BigDecimal balance
) {}
