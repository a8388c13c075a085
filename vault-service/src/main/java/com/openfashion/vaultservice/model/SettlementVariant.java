package com.openfashion.vaultservice.model;

import lombok.Getter;

@Getter
public enum SettlementVariant {

    /**
     * Value held by the vault moves to the destination through a bounded external call.
     * Metadata: externalId, expiry, (blank) token.
     */
    DIRECT_ESCROW(3),

    /**
     * Tokens held by the vault move to the recipient through the token collaborator.
     * Metadata: externalId, expiry, token.
     */
    ESCROW_TOKEN(3),

    /**
     * Tokens move from a pre-approved settlement wallet to the recipient.
     * Metadata: externalId, expiry, token, wallet.
     */
    DELEGATED_ALLOWANCE(4);

    private final int metadataFields;

    SettlementVariant(int metadataFields) {
        this.metadataFields = metadataFields;
    }

    public boolean usesToken() {
        return this != DIRECT_ESCROW;
    }
}
