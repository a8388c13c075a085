package com.openfashion.vaultservice.controller;

import com.openfashion.vaultservice.dto.DepositRequest;
import com.openfashion.vaultservice.dto.VaultSummary;
import com.openfashion.vaultservice.model.VaultEvent;
import com.openfashion.vaultservice.service.OwnerSetService;
import com.openfashion.vaultservice.service.TreasuryService;
import com.openfashion.vaultservice.service.VaultQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/vault")
@RequiredArgsConstructor
public class VaultController {

    private final VaultQueryService vaultQueryService;
    private final OwnerSetService ownerSetService;
    private final TreasuryService treasuryService;

    @GetMapping
    public VaultSummary summary() {
        return vaultQueryService.getSummary();
    }

    @GetMapping("/owners")
    public List<String> owners() {
        return ownerSetService.getOwners();
    }

    // Anyone may fund the vault
    @PostMapping("/deposits")
    public ResponseEntity<Void> deposit(
            @RequestHeader("X-Caller-ID") String caller,
            @RequestBody @Valid DepositRequest request
    ) {
        treasuryService.deposit(caller, request.value());
        return new ResponseEntity<>(HttpStatus.CREATED);
    }

    @GetMapping("/events")
    public List<VaultEvent> events(@RequestParam(defaultValue = "0") long after,
                                   @RequestParam(defaultValue = "100") int limit) {
        return vaultQueryService.getEvents(after, limit);
    }
}
