package com.openfashion.vaultservice.service;

import com.openfashion.vaultservice.model.Transaction;

import java.math.BigDecimal;
import java.util.List;

public interface TransactionLedgerService {

    Long submitTransaction(String caller, String destination, BigDecimal value, byte[] payload);

    void confirmTransaction(String caller, Long transactionId);

    void revokeConfirmation(String caller, Long transactionId);

    boolean executeTransaction(String caller, Long transactionId);

    boolean isConfirmed(Long transactionId);

    int getConfirmationCount(Long transactionId);

    List<String> getConfirmations(Long transactionId);

    Transaction getTransaction(Long transactionId);
}
