package com.openfashion.vaultservice.dto.call;

import java.math.BigDecimal;

public record ExternalCall(
        String from,
        String to,
        BigDecimal value,
        byte[] payload
) {}
