package com.openfashion.vaultservice.service.strategy;

import com.openfashion.vaultservice.model.SettlementVariant;
import com.openfashion.vaultservice.model.Subscription;

/**
 * Moves one cycle's value for a subscription. Implementations report failure through the
 * result and never touch the subscription's own fields.
 */
public interface SettlementStrategy {

    boolean supports(SettlementVariant variant);

    SettlementResult settle(Subscription subscription, String vaultAddress);
}
