package com.openfashion.vaultservice.client.registry;

/**
 * Payment-tracking registry: decides which accounts may execute subscriptions and
 * receives notice of new subscriptions and settled cycles.
 */
public interface OperatorRegistry {

    boolean isConfigured();

    boolean isOperator(String account);

    void handleNewSubscription(String destination, String vaultId, Long subscriptionId, String externalId);

    void handlePaymentNotification(String destination, Long subscriptionId, String externalId, boolean firstCycle);
}
