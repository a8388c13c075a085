package com.openfashion.vaultservice.service;

import com.openfashion.vaultservice.dto.SubscriptionRequest;
import com.openfashion.vaultservice.model.Subscription;

public interface SubscriptionLedgerService {

    Long submitSubscription(String caller, SubscriptionRequest request);

    void cancelSubscription(String caller, Long subscriptionId);

    void pauseSubscription(String caller, Long subscriptionId);

    void resumeSubscription(String caller, Long subscriptionId);

    boolean executeSubscription(String caller, Long subscriptionId);

    Subscription getSubscription(Long subscriptionId);
}
