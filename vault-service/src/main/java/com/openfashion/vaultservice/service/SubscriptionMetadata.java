package com.openfashion.vaultservice.service;

import com.openfashion.vaultservice.core.exceptions.InvalidSubscriptionMetadataException;
import com.openfashion.vaultservice.model.SettlementVariant;
import com.openfashion.vaultservice.model.Subscription;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Positional metadata attached to a subscription:
 * {@code [externalId, expiry, token]} for the escrow variants and
 * {@code [externalId, expiry, token, wallet]} for delegated allowance.
 * A blank expiry means the subscription never expires.
 */
public record SubscriptionMetadata(
        String externalId,
        Instant expiresAt,
        String token,
        String wallet
) {

    public static SubscriptionMetadata decode(SettlementVariant variant, List<String> fields, Instant now) {
        if (fields == null || fields.size() != variant.getMetadataFields()) {
            throw new InvalidSubscriptionMetadataException(String.format("%s expects %d fields, got %d",
                    variant, variant.getMetadataFields(), fields == null ? 0 : fields.size()));
        }

        String externalId = fields.get(0);
        if (isBlank(externalId)) {
            throw new InvalidSubscriptionMetadataException("external id is required");
        }

        Instant expiresAt = parseExpiry(fields.get(1));
        if (!expiresAt.isAfter(now)) {
            throw new InvalidSubscriptionMetadataException("expiry " + expiresAt + " is not in the future");
        }

        String token = fields.get(2);
        if (variant.usesToken() && isBlank(token)) {
            throw new InvalidSubscriptionMetadataException("token is required for " + variant);
        }
        if (!variant.usesToken() && !isBlank(token)) {
            throw new InvalidSubscriptionMetadataException("token must be blank for " + variant);
        }

        String wallet = null;
        if (variant == SettlementVariant.DELEGATED_ALLOWANCE) {
            wallet = fields.get(3);
            if (isBlank(wallet)) {
                throw new InvalidSubscriptionMetadataException("settlement wallet is required for " + variant);
            }
        }

        return new SubscriptionMetadata(externalId, expiresAt, variant.usesToken() ? token : null, wallet);
    }

    private static Instant parseExpiry(String raw) {
        if (isBlank(raw)) {
            return Subscription.NEVER_EXPIRES;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidSubscriptionMetadataException("expiry '" + raw + "' is not an ISO-8601 instant");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
