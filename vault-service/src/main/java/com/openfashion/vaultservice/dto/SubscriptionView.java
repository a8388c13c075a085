package com.openfashion.vaultservice.dto;

import com.openfashion.vaultservice.model.SettlementVariant;
import com.openfashion.vaultservice.model.Subscription;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record SubscriptionView(
        Long id,
        String destination,
        String recipient,
        String wallet,
        String token,
        BigDecimal value,
        SettlementVariant variant,
        Instant createdAt,
        Instant expiresAt,
        long cycle,
        long periodSeconds,
        Instant withdrawPrev,
        Instant withdrawNext,
        String externalId,
        List<String> metadata,
        boolean paused
) {

    public static SubscriptionView of(Subscription subscription) {
        return new SubscriptionView(
                subscription.getId(),
                subscription.getDestination(),
                subscription.getRecipient(),
                subscription.getWallet(),
                subscription.getToken(),
                subscription.getValue(),
                subscription.getVariant(),
                subscription.getCreatedAt(),
                subscription.getExpiresAt(),
                subscription.getCycle(),
                subscription.getPeriodSeconds(),
                subscription.getWithdrawPrev(),
                subscription.getWithdrawNext(),
                subscription.getExternalId(),
                List.copyOf(subscription.getMetadata()),
                subscription.isPaused()
        );
    }
}
