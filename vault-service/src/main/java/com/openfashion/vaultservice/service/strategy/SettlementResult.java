package com.openfashion.vaultservice.service.strategy;

public record SettlementResult(
        boolean success,
        String failureCode
) {

    public static final String INSUFFICIENT_ESCROW_BALANCE = "INSUFFICIENT_ESCROW_BALANCE";
    public static final String EXTERNAL_CALL_FAILED = "EXTERNAL_CALL_FAILED";
    public static final String TOKEN_TRANSFER_FAILED = "TOKEN_TRANSFER_FAILED";

    public static SettlementResult ok() {
        return new SettlementResult(true, null);
    }

    public static SettlementResult failure(String failureCode) {
        return new SettlementResult(false, failureCode);
    }
}
