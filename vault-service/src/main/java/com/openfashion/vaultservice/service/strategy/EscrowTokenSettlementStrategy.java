package com.openfashion.vaultservice.service.strategy;

import com.openfashion.vaultservice.client.token.TokenCollaborator;
import com.openfashion.vaultservice.model.SettlementVariant;
import com.openfashion.vaultservice.model.Subscription;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

// Tokens held by the vault itself
@Component
@RequiredArgsConstructor
public class EscrowTokenSettlementStrategy implements SettlementStrategy {

    private final TokenCollaborator tokenCollaborator;

    @Override
    public boolean supports(SettlementVariant variant) {
        return variant == SettlementVariant.ESCROW_TOKEN;
    }

    @Override
    public SettlementResult settle(Subscription subscription, String vaultAddress) {
        boolean transferred = tokenCollaborator.transferOnBehalf(
                subscription.getToken(),
                vaultAddress,
                subscription.getRecipient(),
                subscription.getValue()
        );

        return transferred
                ? SettlementResult.ok()
                : SettlementResult.failure(SettlementResult.TOKEN_TRANSFER_FAILED);
    }
}
