package com.openfashion.vaultservice.service;

import com.openfashion.vaultservice.model.Vault;

import java.math.BigDecimal;

public interface TreasuryService {

    Vault loadVault();

    String vaultAddress();

    BigDecimal balance();

    void deposit(String sender, BigDecimal value);

    /**
     * Debits the held balance when it covers {@code value}.
     *
     * @return false, leaving the balance untouched, when it does not
     */
    boolean withdraw(BigDecimal value);

    void refund(BigDecimal value);
}
