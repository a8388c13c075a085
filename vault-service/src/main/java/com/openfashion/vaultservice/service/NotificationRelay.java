package com.openfashion.vaultservice.service;

import com.openfashion.vaultservice.client.registry.OperatorRegistry;
import com.openfashion.vaultservice.model.Subscription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tells the payment-tracking registry about new subscriptions and settled cycles.
 * Delivery is best effort: a failure is logged and never undoes the subscription change.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationRelay {

    private final OperatorRegistry operatorRegistry;

    public void subscriptionCreated(Subscription subscription, String vaultAddress) {
        if (!operatorRegistry.isConfigured()) {
            return;
        }

        try {
            operatorRegistry.handleNewSubscription(
                    subscription.getDestination(),
                    vaultAddress,
                    subscription.getId(),
                    subscription.getExternalId()
            );
        } catch (RuntimeException e) {
            log.warn("Registry was not notified of subscription {}: {}", subscription.getId(), e.getMessage());
        }
    }

    public void paymentExecuted(Subscription subscription, boolean firstCycle) {
        if (!operatorRegistry.isConfigured()) {
            return;
        }

        try {
            operatorRegistry.handlePaymentNotification(
                    subscription.getDestination(),
                    subscription.getId(),
                    subscription.getExternalId(),
                    firstCycle
            );
        } catch (RuntimeException e) {
            log.warn("Registry was not notified of payment for subscription {} (cycle {}): {}",
                    subscription.getId(), subscription.getCycle(), e.getMessage());
        }
    }
}
