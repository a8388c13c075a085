package com.openfashion.vaultservice;

import com.openfashion.vaultservice.core.exceptions.InvalidSubscriptionMetadataException;
import com.openfashion.vaultservice.model.SettlementVariant;
import com.openfashion.vaultservice.model.Subscription;
import com.openfashion.vaultservice.service.SubscriptionMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscriptionMetadataTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    @DisplayName("Direct escrow: blank expiry means open-ended")
    void testDecode_DirectEscrowOpenEnded() {
        SubscriptionMetadata metadata = SubscriptionMetadata.decode(
                SettlementVariant.DIRECT_ESCROW, List.of("order-1", "", ""), NOW);

        assertThat(metadata.externalId()).isEqualTo("order-1");
        assertThat(metadata.expiresAt()).isEqualTo(Subscription.NEVER_EXPIRES);
        assertThat(metadata.token()).isNull();
        assertThat(metadata.wallet()).isNull();
    }

    @Test
    @DisplayName("Delegated allowance: four fields with token and wallet")
    void testDecode_DelegatedAllowance() {
        SubscriptionMetadata metadata = SubscriptionMetadata.decode(SettlementVariant.DELEGATED_ALLOWANCE,
                List.of("order-2", "2026-06-01T00:00:00Z", "token-usd", "payer-wallet"), NOW);

        assertThat(metadata.expiresAt()).isEqualTo(Instant.parse("2026-06-01T00:00:00Z"));
        assertThat(metadata.token()).isEqualTo("token-usd");
        assertThat(metadata.wallet()).isEqualTo("payer-wallet");
    }

    @Test
    @DisplayName("Field count must match the variant")
    void testDecode_WrongFieldCount() {
        assertThatThrownBy(() -> SubscriptionMetadata.decode(SettlementVariant.DELEGATED_ALLOWANCE,
                List.of("order-2", "", "token-usd"), NOW))
                .isInstanceOf(InvalidSubscriptionMetadataException.class);
        assertThatThrownBy(() -> SubscriptionMetadata.decode(SettlementVariant.DIRECT_ESCROW,
                List.of("order-1", "", "", "extra"), NOW))
                .isInstanceOf(InvalidSubscriptionMetadataException.class);
    }

    @Test
    @DisplayName("Expiry must parse and lie in the future")
    void testDecode_Expiry() {
        assertThatThrownBy(() -> SubscriptionMetadata.decode(SettlementVariant.DIRECT_ESCROW,
                List.of("order-1", "next tuesday", ""), NOW))
                .isInstanceOf(InvalidSubscriptionMetadataException.class);
        assertThatThrownBy(() -> SubscriptionMetadata.decode(SettlementVariant.DIRECT_ESCROW,
                List.of("order-1", "2025-12-31T00:00:00Z", ""), NOW))
                .isInstanceOf(InvalidSubscriptionMetadataException.class);
    }

    @Test
    @DisplayName("Token rules: required for token variants, forbidden for direct escrow")
    void testDecode_TokenRules() {
        assertThatThrownBy(() -> SubscriptionMetadata.decode(SettlementVariant.ESCROW_TOKEN,
                List.of("order-1", "", " "), NOW))
                .isInstanceOf(InvalidSubscriptionMetadataException.class);
        assertThatThrownBy(() -> SubscriptionMetadata.decode(SettlementVariant.DIRECT_ESCROW,
                List.of("order-1", "", "token-usd"), NOW))
                .isInstanceOf(InvalidSubscriptionMetadataException.class);
        assertThatThrownBy(() -> SubscriptionMetadata.decode(SettlementVariant.DIRECT_ESCROW,
                List.of("", "", ""), NOW))
                .isInstanceOf(InvalidSubscriptionMetadataException.class);
    }
}
