package com.openfashion.vaultservice.core.config;

import com.openfashion.vaultservice.service.OwnerSetService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeds the vault from {@code app.vault.*} on first start. An invalid owner configuration
 * fails startup.
 */
@Component
@Slf4j
public class VaultInitializer implements ApplicationRunner {

    private final OwnerSetService ownerSetService;
    private final String address;
    private final List<String> owners;
    private final int required;

    public VaultInitializer(OwnerSetService ownerSetService,
                            @Value("${app.vault.address}") String address,
                            @Value("${app.vault.owners}") List<String> owners,
                            @Value("${app.vault.required}") int required) {
        this.ownerSetService = ownerSetService;
        this.address = address;
        this.owners = owners;
        this.required = required;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Initializing vault {} with owners {}", address, owners);
        ownerSetService.initialize(address, owners, required);
    }
}
