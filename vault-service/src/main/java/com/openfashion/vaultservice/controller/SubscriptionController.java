package com.openfashion.vaultservice.controller;

import com.openfashion.vaultservice.dto.*;
import com.openfashion.vaultservice.service.SubscriptionLedgerService;
import com.openfashion.vaultservice.service.VaultQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/vault/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

    private static final String CALLER = "X-Caller-ID";

    private final SubscriptionLedgerService subscriptionLedgerService;
    private final VaultQueryService vaultQueryService;

    @PostMapping
    public ResponseEntity<SubmissionResult> submit(
            @RequestHeader(CALLER) String caller,
            @RequestBody @Valid SubscriptionRequest request
    ) {
        Long id = subscriptionLedgerService.submitSubscription(caller, request);
        return new ResponseEntity<>(new SubmissionResult(id), HttpStatus.CREATED);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> cancel(@RequestHeader(CALLER) String caller, @PathVariable Long id) {
        subscriptionLedgerService.cancelSubscription(caller, id);
        return new ResponseEntity<>(HttpStatus.OK);
    }

    @PostMapping("/{id}/execution")
    public ExecutionResult execute(@RequestHeader(CALLER) String caller, @PathVariable Long id) {
        return new ExecutionResult(id, subscriptionLedgerService.executeSubscription(caller, id));
    }

    @PostMapping("/{id}/pause")
    public ResponseEntity<Void> pause(@RequestHeader(CALLER) String caller, @PathVariable Long id) {
        subscriptionLedgerService.pauseSubscription(caller, id);
        return new ResponseEntity<>(HttpStatus.OK);
    }

    @PostMapping("/{id}/resume")
    public ResponseEntity<Void> resume(@RequestHeader(CALLER) String caller, @PathVariable Long id) {
        subscriptionLedgerService.resumeSubscription(caller, id);
        return new ResponseEntity<>(HttpStatus.OK);
    }

    @GetMapping("/{id}")
    public SubscriptionView get(@PathVariable Long id) {
        return vaultQueryService.getSubscription(id);
    }

    @GetMapping
    public IdPage range(@RequestParam(defaultValue = "0") int from,
                        @RequestParam(defaultValue = "50") int to,
                        @RequestParam(defaultValue = "true") boolean withdrawable,
                        @RequestParam(defaultValue = "false") boolean expired) {
        return new IdPage(
                vaultQueryService.getSubscriptionCount(withdrawable, expired),
                vaultQueryService.getSubscriptionIds(from, to, withdrawable, expired)
        );
    }
}
