package com.openfashion.vaultservice.dto;

import com.openfashion.vaultservice.model.Transaction;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record TransactionView(
        Long id,
        String destination,
        BigDecimal value,
        byte[] payload,
        boolean executed,
        String submittedBy,
        Instant createdAt,
        List<String> confirmations
) {

    public static TransactionView of(Transaction transaction, List<String> confirmations) {
        return new TransactionView(
                transaction.getId(),
                transaction.getDestination(),
                transaction.getValue(),
                transaction.getPayload(),
                transaction.isExecuted(),
                transaction.getSubmittedBy(),
                transaction.getCreatedAt(),
                confirmations
        );
    }
}
