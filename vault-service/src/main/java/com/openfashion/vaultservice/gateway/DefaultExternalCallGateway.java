package com.openfashion.vaultservice.gateway;

import com.openfashion.vaultservice.core.util.MoneyUtil;
import com.openfashion.vaultservice.dto.call.ExternalCall;
import com.openfashion.vaultservice.service.TreasuryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@Slf4j
@RequiredArgsConstructor
public class DefaultExternalCallGateway implements ExternalCallGateway {

    private final TreasuryService treasuryService;
    private final PrincipalTransport principalTransport;
    private final SelfCallHandler selfCallHandler;

    @Override
    public boolean call(String destination, BigDecimal value, byte[] payload) {
        String vaultAddress;
        try {
            vaultAddress = treasuryService.vaultAddress();
        } catch (RuntimeException e) {
            log.warn("Call to {} aborted: {}", destination, e.getMessage());
            return false;
        }

        if (vaultAddress.equals(destination)) {
            return selfCallHandler.handle(vaultAddress, payload);
        }

        BigDecimal amount = MoneyUtil.format(value);
        boolean debited = amount.signum() > 0;
        if (debited && !treasuryService.withdraw(amount)) {
            log.warn("Call to {} rejected: balance does not cover {}", destination, amount);
            return false;
        }

        boolean delivered;
        try {
            delivered = principalTransport.deliver(new ExternalCall(vaultAddress, destination, amount, payload));
        } catch (RuntimeException e) {
            log.warn("Call to {} failed: {}", destination, e.getMessage());
            delivered = false;
        }

        if (!delivered && debited) {
            treasuryService.refund(amount);
            log.info("Refunded {} after failed call to {}", amount, destination);
        }
        return delivered;
    }
}
