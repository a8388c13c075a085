package com.openfashion.vaultservice.service.imp;

import com.openfashion.vaultservice.core.exceptions.InvalidValueException;
import com.openfashion.vaultservice.core.exceptions.VaultNotInitializedException;
import com.openfashion.vaultservice.core.invocation.InvocationSerializer;
import com.openfashion.vaultservice.core.util.MoneyUtil;
import com.openfashion.vaultservice.dto.event.VaultEventPayload;
import com.openfashion.vaultservice.model.Vault;
import com.openfashion.vaultservice.model.VaultEventType;
import com.openfashion.vaultservice.repository.VaultRepository;
import com.openfashion.vaultservice.service.TreasuryService;
import com.openfashion.vaultservice.service.VaultEventRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

@Service
@Slf4j
@RequiredArgsConstructor
public class TreasuryServiceImp implements TreasuryService {

    private final VaultRepository vaultRepository;
    private final VaultEventRecorder eventRecorder;
    private final InvocationSerializer invocations;

    @Override
    public Vault loadVault() {
        return vaultRepository.findById(Vault.SINGLETON_ID)
                .orElseThrow(VaultNotInitializedException::new);
    }

    @Override
    public String vaultAddress() {
        return loadVault().getAddress();
    }

    @Override
    public BigDecimal balance() {
        return MoneyUtil.format(loadVault().getBalance());
    }

    @Override
    public void deposit(String sender, BigDecimal value) {
        invocations.run(() -> {
            if (!MoneyUtil.isPositive(value)) {
                throw new InvalidValueException("Deposit must be greater than zero");
            }
            if (!MoneyUtil.fitsScale(value)) {
                throw new InvalidValueException("Deposit allows at most " + MoneyUtil.SCALE + " decimal places");
            }

            Vault vault = loadVault();
            vault.setBalance(MoneyUtil.format(vault.getBalance().add(value)));
            vaultRepository.save(vault);

            eventRecorder.record(VaultEventType.DEPOSIT, vault.getAddress(), VaultEventPayload.builder()
                    .actor(sender)
                    .value(MoneyUtil.format(value))
                    .build());

            log.info("Deposit of {} from {}, balance now {}", value, sender, vault.getBalance());
        });
    }

    @Override
    public boolean withdraw(BigDecimal value) {
        Vault vault = loadVault();
        if (!MoneyUtil.covers(vault.getBalance(), value)) {
            log.warn("Balance {} does not cover withdrawal of {}", vault.getBalance(), value);
            return false;
        }

        vault.setBalance(MoneyUtil.format(vault.getBalance().subtract(MoneyUtil.format(value))));
        vaultRepository.save(vault);
        return true;
    }

    @Override
    public void refund(BigDecimal value) {
        Vault vault = loadVault();
        vault.setBalance(MoneyUtil.format(vault.getBalance().add(MoneyUtil.format(value))));
        vaultRepository.save(vault);
    }
}
