package com.openfashion.vaultservice.service.strategy;

import com.openfashion.vaultservice.core.util.MoneyUtil;
import com.openfashion.vaultservice.gateway.ExternalCallGateway;
import com.openfashion.vaultservice.model.SettlementVariant;
import com.openfashion.vaultservice.model.Subscription;
import com.openfashion.vaultservice.service.TreasuryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class DirectEscrowSettlementStrategy implements SettlementStrategy {

    private final TreasuryService treasuryService;
    private final ExternalCallGateway externalCallGateway;

    @Override
    public boolean supports(SettlementVariant variant) {
        return variant == SettlementVariant.DIRECT_ESCROW;
    }

    @Override
    public SettlementResult settle(Subscription subscription, String vaultAddress) {
        if (!MoneyUtil.covers(treasuryService.balance(), subscription.getValue())) {
            log.warn("Subscription {} needs {} but the vault holds {}",
                    subscription.getId(), subscription.getValue(), treasuryService.balance());
            return SettlementResult.failure(SettlementResult.INSUFFICIENT_ESCROW_BALANCE);
        }

        boolean delivered = externalCallGateway.call(
                subscription.getDestination(),
                subscription.getValue(),
                subscription.getPayload()
        );

        return delivered
                ? SettlementResult.ok()
                : SettlementResult.failure(SettlementResult.EXTERNAL_CALL_FAILED);
    }
}
