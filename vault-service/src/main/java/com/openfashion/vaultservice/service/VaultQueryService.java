package com.openfashion.vaultservice.service;

import com.openfashion.vaultservice.dto.SubscriptionView;
import com.openfashion.vaultservice.dto.TransactionView;
import com.openfashion.vaultservice.dto.VaultSummary;
import com.openfashion.vaultservice.model.VaultEvent;

import java.util.List;

public interface VaultQueryService {

    VaultSummary getSummary();

    TransactionView getTransaction(Long transactionId);

    long getTransactionCount(boolean pending, boolean executed);

    List<Long> getTransactionIds(int from, int to, boolean pending, boolean executed);

    SubscriptionView getSubscription(Long subscriptionId);

    long getSubscriptionCount(boolean withdrawable, boolean expired);

    List<Long> getSubscriptionIds(int from, int to, boolean withdrawable, boolean expired);

    List<VaultEvent> getEvents(long afterId, int limit);
}
