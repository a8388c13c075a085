package com.openfashion.vaultservice.dto.call;

import java.math.BigDecimal;

public record TokenTransferCommand(
        String operation,
        String from,
        String to,
        BigDecimal value
) {

    public static final String TRANSFER_ON_BEHALF = "transferOnBehalf";

    public static TokenTransferCommand transferOnBehalf(String from, String to, BigDecimal value) {
        return new TokenTransferCommand(TRANSFER_ON_BEHALF, from, to, value);
    }
}
