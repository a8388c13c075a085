package com.openfashion.vaultservice.model;

import lombok.Getter;

@Getter
public enum VaultEventType {

    TRANSACTION_SUBMITTED(Topic.TRANSACTIONS),
    TRANSACTION_CONFIRMED(Topic.TRANSACTIONS),
    CONFIRMATION_REVOKED(Topic.TRANSACTIONS),
    TRANSACTION_EXECUTED(Topic.TRANSACTIONS),
    TRANSACTION_EXECUTION_FAILED(Topic.TRANSACTIONS),

    SUBSCRIPTION_ADDED(Topic.SUBSCRIPTIONS),
    SUBSCRIPTION_CANCELLED(Topic.SUBSCRIPTIONS),
    SUBSCRIPTION_PAUSED(Topic.SUBSCRIPTIONS),
    SUBSCRIPTION_RESUMED(Topic.SUBSCRIPTIONS),
    SUBSCRIPTION_EXECUTED(Topic.SUBSCRIPTIONS),
    SUBSCRIPTION_EXECUTION_FAILED(Topic.SUBSCRIPTIONS),

    OWNER_ADDED(Topic.OWNERS),
    OWNER_REMOVED(Topic.OWNERS),
    REQUIREMENT_CHANGED(Topic.OWNERS),

    DEPOSIT(Topic.DEPOSITS);

    private final String topic;

    VaultEventType(String topic) {
        this.topic = topic;
    }

    private static final class Topic {
        static final String TRANSACTIONS = "vault.transactions";
        static final String SUBSCRIPTIONS = "vault.subscriptions";
        static final String OWNERS = "vault.owners";
        static final String DEPOSITS = "vault.deposits";
    }
}
