package com.openfashion.vaultservice.controller;

import com.openfashion.vaultservice.dto.*;
import com.openfashion.vaultservice.dto.call.OwnerCommand;
import com.openfashion.vaultservice.core.exceptions.InvalidOwnerConfigurationException;
import com.openfashion.vaultservice.gateway.OwnerCommandCodec;
import com.openfashion.vaultservice.service.TransactionLedgerService;
import com.openfashion.vaultservice.service.TreasuryService;
import com.openfashion.vaultservice.service.VaultQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/vault/transactions")
@RequiredArgsConstructor
public class TransactionController {

    private static final String CALLER = "X-Caller-ID";

    private final TransactionLedgerService transactionLedgerService;
    private final VaultQueryService vaultQueryService;
    private final TreasuryService treasuryService;
    private final OwnerCommandCodec ownerCommandCodec;

    @PostMapping
    public ResponseEntity<SubmissionResult> submit(
            @RequestHeader(CALLER) String caller,
            @RequestBody @Valid TransactionRequest request
    ) {
        Long id = transactionLedgerService.submitTransaction(caller, request.destination(), request.value(), request.payload());
        return new ResponseEntity<>(new SubmissionResult(id), HttpStatus.CREATED);
    }

    /**
     * Proposes an owner-set change as a transaction addressed to the vault itself.
     * The change only applies once the transaction gathers enough confirmations.
     */
    @PostMapping("/owner-changes")
    public ResponseEntity<SubmissionResult> proposeOwnerChange(
            @RequestHeader(CALLER) String caller,
            @RequestBody @Valid OwnerChangeRequest request
    ) {
        byte[] payload = ownerCommandCodec.encode(toCommand(request));
        Long id = transactionLedgerService.submitTransaction(caller, treasuryService.vaultAddress(), BigDecimal.ZERO, payload);
        return new ResponseEntity<>(new SubmissionResult(id), HttpStatus.CREATED);
    }

    @PostMapping("/{id}/confirmations")
    public ResponseEntity<Void> confirm(@RequestHeader(CALLER) String caller, @PathVariable Long id) {
        transactionLedgerService.confirmTransaction(caller, id);
        return new ResponseEntity<>(HttpStatus.OK);
    }

    @DeleteMapping("/{id}/confirmations")
    public ResponseEntity<Void> revoke(@RequestHeader(CALLER) String caller, @PathVariable Long id) {
        transactionLedgerService.revokeConfirmation(caller, id);
        return new ResponseEntity<>(HttpStatus.OK);
    }

    @PostMapping("/{id}/execution")
    public ExecutionResult execute(@RequestHeader(CALLER) String caller, @PathVariable Long id) {
        return new ExecutionResult(id, transactionLedgerService.executeTransaction(caller, id));
    }

    @GetMapping("/{id}")
    public TransactionView get(@PathVariable Long id) {
        return vaultQueryService.getTransaction(id);
    }

    @GetMapping("/{id}/confirmations")
    public List<String> confirmations(@PathVariable Long id) {
        transactionLedgerService.getTransaction(id);
        return transactionLedgerService.getConfirmations(id);
    }

    @GetMapping
    public IdPage range(@RequestParam(defaultValue = "0") int from,
                        @RequestParam(defaultValue = "50") int to,
                        @RequestParam(defaultValue = "true") boolean pending,
                        @RequestParam(defaultValue = "true") boolean executed) {
        return new IdPage(
                vaultQueryService.getTransactionCount(pending, executed),
                vaultQueryService.getTransactionIds(from, to, pending, executed)
        );
    }

    private OwnerCommand toCommand(OwnerChangeRequest request) {
        return switch (request.type()) {
            case ADD_OWNER -> OwnerCommand.addOwner(request.owner());
            case REMOVE_OWNER -> OwnerCommand.removeOwner(request.owner());
            case REPLACE_OWNER -> OwnerCommand.replaceOwner(request.owner(), request.newOwner());
            case CHANGE_REQUIREMENT -> {
                if (request.required() == null) {
                    throw new InvalidOwnerConfigurationException("Required confirmations are missing");
                }
                yield OwnerCommand.changeRequirement(request.required());
            }
        };
    }
}
