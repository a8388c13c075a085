package com.openfashion.vaultservice.service.imp;

import com.openfashion.vaultservice.core.exceptions.InvalidValueException;
import com.openfashion.vaultservice.core.exceptions.StateConflictException;
import com.openfashion.vaultservice.core.exceptions.TransactionNotFoundException;
import com.openfashion.vaultservice.core.invocation.InvocationSerializer;
import com.openfashion.vaultservice.core.util.MoneyUtil;
import com.openfashion.vaultservice.dto.event.VaultEventPayload;
import com.openfashion.vaultservice.gateway.ExternalCallGateway;
import com.openfashion.vaultservice.model.Confirmation;
import com.openfashion.vaultservice.model.Transaction;
import com.openfashion.vaultservice.model.VaultEventType;
import com.openfashion.vaultservice.repository.ConfirmationRepository;
import com.openfashion.vaultservice.repository.TransactionRepository;
import com.openfashion.vaultservice.service.OwnerSetService;
import com.openfashion.vaultservice.service.TransactionLedgerService;
import com.openfashion.vaultservice.service.VaultEventRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class TransactionLedgerServiceImp implements TransactionLedgerService {

    private final TransactionRepository transactionRepository;
    private final ConfirmationRepository confirmationRepository;
    private final OwnerSetService ownerSetService;
    private final ExternalCallGateway externalCallGateway;
    private final VaultEventRecorder eventRecorder;
    private final InvocationSerializer invocations;
    private final Clock clock;

    @Override
    public Long submitTransaction(String caller, String destination, BigDecimal value, byte[] payload) {
        return invocations.invoke(() -> {
            ownerSetService.requireOwner(caller, "submit transactions");

            if (destination == null || destination.isBlank()) {
                throw new InvalidValueException("Destination is required");
            }
            if (value == null || value.signum() < 0) {
                throw new InvalidValueException("Value must not be negative");
            }
            if (!MoneyUtil.fitsScale(value)) {
                throw new InvalidValueException("Value allows at most " + MoneyUtil.SCALE + " decimal places");
            }

            Transaction transaction = transactionRepository.save(Transaction.builder()
                    .destination(destination)
                    .value(MoneyUtil.format(value))
                    .payload(payload == null ? new byte[0] : payload)
                    .executed(false)
                    .submittedBy(caller)
                    .createdAt(clock.instant())
                    .build());

            eventRecorder.record(VaultEventType.TRANSACTION_SUBMITTED, transaction.getId(), VaultEventPayload.builder()
                    .actor(caller)
                    .transactionId(transaction.getId())
                    .destination(destination)
                    .value(transaction.getValue())
                    .build());
            log.info("Transaction {} submitted by {}: {} to {}", transaction.getId(), caller, transaction.getValue(), destination);

            confirm(caller, transaction);
            return transaction.getId();
        });
    }

    @Override
    public void confirmTransaction(String caller, Long transactionId) {
        invocations.run(() -> {
            ownerSetService.requireOwner(caller, "confirm transactions");
            confirm(caller, load(transactionId));
        });
    }

    @Override
    public void revokeConfirmation(String caller, Long transactionId) {
        invocations.run(() -> {
            ownerSetService.requireOwner(caller, "revoke confirmations");
            Transaction transaction = load(transactionId);

            Confirmation confirmation = confirmationRepository.findByTransactionIdAndOwner(transactionId, caller)
                    .filter(Confirmation::isConfirmed)
                    .orElseThrow(() -> new StateConflictException(
                            "Transaction " + transactionId + " is not confirmed by " + caller));
            if (transaction.isExecuted()) {
                throw new StateConflictException("Transaction " + transactionId + " is already executed");
            }

            confirmation.setConfirmed(false);
            confirmation.setUpdatedAt(clock.instant());
            confirmationRepository.save(confirmation);

            eventRecorder.record(VaultEventType.CONFIRMATION_REVOKED, transactionId, VaultEventPayload.builder()
                    .actor(caller)
                    .transactionId(transactionId)
                    .build());
            log.info("Confirmation of transaction {} revoked by {}", transactionId, caller);
        });
    }

    @Override
    public boolean executeTransaction(String caller, Long transactionId) {
        return invocations.invoke(() -> {
            ownerSetService.requireOwner(caller, "execute transactions");
            Transaction transaction = load(transactionId);

            if (transaction.isExecuted()) {
                throw new StateConflictException("Transaction " + transactionId + " is already executed");
            }
            if (!isConfirmed(transactionId)) {
                throw new StateConflictException("Transaction " + transactionId + " lacks the required confirmations");
            }

            return execute(caller, transaction);
        });
    }

    @Override
    public boolean isConfirmed(Long transactionId) {
        Set<String> confirmedBy = confirmedBy(transactionId);
        int required = ownerSetService.getRequired();

        int count = 0;
        for (String owner : ownerSetService.getOwners()) {
            if (confirmedBy.contains(owner)) {
                count++;
            }
            if (count == required) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int getConfirmationCount(Long transactionId) {
        return getConfirmations(transactionId).size();
    }

    @Override
    public List<String> getConfirmations(Long transactionId) {
        Set<String> confirmedBy = confirmedBy(transactionId);
        return ownerSetService.getOwners().stream()
                .filter(confirmedBy::contains)
                .toList();
    }

    @Override
    public Transaction getTransaction(Long transactionId) {
        return load(transactionId);
    }

    private void confirm(String caller, Transaction transaction) {
        Long transactionId = transaction.getId();
        if (transaction.isExecuted()) {
            throw new StateConflictException("Transaction " + transactionId + " is already executed");
        }

        Confirmation confirmation = confirmationRepository.findByTransactionIdAndOwner(transactionId, caller)
                .orElseGet(() -> Confirmation.builder()
                        .transactionId(transactionId)
                        .owner(caller)
                        .build());
        if (confirmation.isConfirmed()) {
            throw new StateConflictException("Transaction " + transactionId + " is already confirmed by " + caller);
        }

        confirmation.setConfirmed(true);
        confirmation.setUpdatedAt(clock.instant());
        confirmationRepository.save(confirmation);

        eventRecorder.record(VaultEventType.TRANSACTION_CONFIRMED, transactionId, VaultEventPayload.builder()
                .actor(caller)
                .transactionId(transactionId)
                .build());
        log.info("Transaction {} confirmed by {}", transactionId, caller);

        if (isConfirmed(transactionId)) {
            execute(caller, transaction);
        }
    }

    // Marks executed and flushes before calling out, so a callback into the ledger sees the
    // transaction as spent and a stale version fails before any value leaves the vault
    private boolean execute(String caller, Transaction transaction) {
        transaction.setExecuted(true);
        transactionRepository.saveAndFlush(transaction);

        boolean success = externalCallGateway.call(
                transaction.getDestination(),
                transaction.getValue(),
                transaction.getPayload()
        );

        VaultEventPayload payload = VaultEventPayload.builder()
                .actor(caller)
                .transactionId(transaction.getId())
                .destination(transaction.getDestination())
                .value(transaction.getValue())
                .build();

        if (success) {
            eventRecorder.record(VaultEventType.TRANSACTION_EXECUTED, transaction.getId(), payload);
            log.info("Transaction {} executed", transaction.getId());
            return true;
        }

        transaction.setExecuted(false);
        transactionRepository.save(transaction);
        eventRecorder.record(VaultEventType.TRANSACTION_EXECUTION_FAILED, transaction.getId(), payload);
        log.warn("Transaction {} failed to execute, left pending", transaction.getId());
        return false;
    }

    private Set<String> confirmedBy(Long transactionId) {
        return confirmationRepository.findAllByTransactionIdAndConfirmedTrue(transactionId).stream()
                .map(Confirmation::getOwner)
                .collect(Collectors.toSet());
    }

    private Transaction load(Long transactionId) {
        return transactionRepository.findById(transactionId)
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }
}
