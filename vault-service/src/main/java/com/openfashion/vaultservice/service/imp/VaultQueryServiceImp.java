package com.openfashion.vaultservice.service.imp;

import com.openfashion.vaultservice.core.exceptions.InvalidValueException;
import com.openfashion.vaultservice.dto.SubscriptionView;
import com.openfashion.vaultservice.dto.TransactionView;
import com.openfashion.vaultservice.dto.VaultSummary;
import com.openfashion.vaultservice.model.Subscription;
import com.openfashion.vaultservice.model.Transaction;
import com.openfashion.vaultservice.model.Vault;
import com.openfashion.vaultservice.model.VaultEvent;
import com.openfashion.vaultservice.repository.SubscriptionRepository;
import com.openfashion.vaultservice.repository.TransactionRepository;
import com.openfashion.vaultservice.repository.VaultEventRepository;
import com.openfashion.vaultservice.service.*;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class VaultQueryServiceImp implements VaultQueryService {

    private static final int MAX_EVENT_PAGE = 500;

    private final TransactionRepository transactionRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final VaultEventRepository eventRepository;
    private final TransactionLedgerService transactionLedgerService;
    private final SubscriptionLedgerService subscriptionLedgerService;
    private final OwnerSetService ownerSetService;
    private final TreasuryService treasuryService;
    private final Clock clock;

    @Override
    public VaultSummary getSummary() {
        Vault vault = treasuryService.loadVault();
        return new VaultSummary(
                vault.getAddress(),
                ownerSetService.getOwners(),
                vault.getRequired(),
                treasuryService.balance()
        );
    }

    @Override
    public TransactionView getTransaction(Long transactionId) {
        Transaction transaction = transactionLedgerService.getTransaction(transactionId);
        return TransactionView.of(transaction, transactionLedgerService.getConfirmations(transactionId));
    }

    @Override
    public long getTransactionCount(boolean pending, boolean executed) {
        long count = 0;
        if (pending) {
            count += transactionRepository.countByExecuted(false);
        }
        if (executed) {
            count += transactionRepository.countByExecuted(true);
        }
        return count;
    }

    @Override
    public List<Long> getTransactionIds(int from, int to, boolean pending, boolean executed) {
        Predicate<Transaction> filter = t -> (pending && !t.isExecuted()) || (executed && t.isExecuted());
        List<Long> ids = transactionRepository.findAllByOrderByIdAsc().stream()
                .filter(filter)
                .map(Transaction::getId)
                .toList();
        return slice(ids, from, to);
    }

    @Override
    public SubscriptionView getSubscription(Long subscriptionId) {
        return SubscriptionView.of(subscriptionLedgerService.getSubscription(subscriptionId));
    }

    @Override
    public long getSubscriptionCount(boolean withdrawable, boolean expired) {
        return matchingSubscriptions(withdrawable, expired).size();
    }

    @Override
    public List<Long> getSubscriptionIds(int from, int to, boolean withdrawable, boolean expired) {
        return slice(matchingSubscriptions(withdrawable, expired), from, to);
    }

    @Override
    public List<VaultEvent> getEvents(long afterId, int limit) {
        if (limit < 1 || limit > MAX_EVENT_PAGE) {
            throw new InvalidValueException("Limit must be between 1 and " + MAX_EVENT_PAGE);
        }
        return eventRepository.findAllByIdGreaterThanOrderByIdAsc(afterId, PageRequest.of(0, limit));
    }

    private List<Long> matchingSubscriptions(boolean withdrawable, boolean expired) {
        Instant now = clock.instant();
        Predicate<Subscription> filter = s -> (withdrawable && s.isWithdrawable(now)) || (expired && s.isExpired(now));
        return subscriptionRepository.findAllByOrderByIdAsc().stream()
                .filter(filter)
                .map(Subscription::getId)
                .toList();
    }

    // Half-open range [from, to) over the filtered ids, clamped to the end of the list
    private List<Long> slice(List<Long> ids, int from, int to) {
        if (from < 0 || to < from) {
            throw new InvalidValueException("Invalid range [" + from + ", " + to + ")");
        }
        if (from >= ids.size()) {
            return List.of();
        }
        return ids.subList(from, Math.min(to, ids.size()));
    }
}
