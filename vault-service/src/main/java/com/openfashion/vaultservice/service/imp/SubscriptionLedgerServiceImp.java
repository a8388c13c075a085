package com.openfashion.vaultservice.service.imp;

import com.openfashion.vaultservice.client.registry.OperatorRegistry;
import com.openfashion.vaultservice.core.exceptions.InvalidValueException;
import com.openfashion.vaultservice.core.exceptions.StateConflictException;
import com.openfashion.vaultservice.core.exceptions.SubscriptionNotFoundException;
import com.openfashion.vaultservice.core.exceptions.UnauthorizedCallerException;
import com.openfashion.vaultservice.core.exceptions.UnsupportedSettlementVariantException;
import com.openfashion.vaultservice.core.invocation.InvocationSerializer;
import com.openfashion.vaultservice.core.util.MoneyUtil;
import com.openfashion.vaultservice.dto.SubscriptionRequest;
import com.openfashion.vaultservice.dto.event.VaultEventPayload;
import com.openfashion.vaultservice.model.SettlementVariant;
import com.openfashion.vaultservice.model.Subscription;
import com.openfashion.vaultservice.model.VaultEventType;
import com.openfashion.vaultservice.repository.SubscriptionRepository;
import com.openfashion.vaultservice.service.*;
import com.openfashion.vaultservice.service.strategy.SettlementResult;
import com.openfashion.vaultservice.service.strategy.SettlementStrategy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class SubscriptionLedgerServiceImp implements SubscriptionLedgerService {

    private static final String IN_FLIGHT_KEY_PREFIX = "vault:subscription:in-flight:";

    private final SubscriptionRepository subscriptionRepository;
    private final OwnerSetService ownerSetService;
    private final TreasuryService treasuryService;
    private final OperatorRegistry operatorRegistry;
    private final NotificationRelay notificationRelay;
    private final InFlightLockService inFlightLockService;
    private final VaultEventRecorder eventRecorder;
    private final InvocationSerializer invocations;
    private final Clock clock;

    private final Map<SettlementVariant, SettlementStrategy> strategyMap = new EnumMap<>(SettlementVariant.class);
    private final List<SettlementStrategy> strategies;

    @PostConstruct
    public void initStrategies() {
        for (SettlementVariant variant : SettlementVariant.values()) {
            strategies.stream()
                    .filter(s -> s.supports(variant))
                    .findFirst()
                    .ifPresentOrElse(
                            s -> strategyMap.put(variant, s),
                            () -> log.warn("No settlement strategy found for variant: {}", variant)
                    );
        }
    }

    @Override
    public Long submitSubscription(String caller, SubscriptionRequest request) {
        return invocations.invoke(() -> {
            ownerSetService.requireOwner(caller, "submit subscriptions");
            Instant now = clock.instant();
            validate(request, now);
            SubscriptionMetadata metadata = SubscriptionMetadata.decode(request.variant(), request.metadata(), now);
            BigDecimal value = MoneyUtil.format(request.value());
            BigDecimal attached = MoneyUtil.format(request.attachedValue());

            if (attached.signum() > 0) {
                treasuryService.deposit(caller, attached);
            }

            Subscription subscription = subscriptionRepository.save(Subscription.builder()
                    .destination(request.destination())
                    .recipient(request.recipient())
                    .wallet(metadata.wallet())
                    .token(metadata.token())
                    .value(value)
                    .variant(request.variant())
                    .createdAt(now)
                    .expiresAt(metadata.expiresAt())
                    .cycle(0)
                    .periodSeconds(request.periodSeconds())
                    .withdrawNext(now)
                    .externalId(metadata.externalId())
                    .payload(request.payload() == null ? new byte[0] : request.payload())
                    .metadata(storedMetadata(request.metadata()))
                    .paused(false)
                    .submittedBy(caller)
                    .build());

            eventRecorder.record(VaultEventType.SUBSCRIPTION_ADDED, subscription.getId(), VaultEventPayload.builder()
                    .actor(caller)
                    .subscriptionId(subscription.getId())
                    .destination(subscription.getDestination())
                    .value(value)
                    .build());
            log.info("Subscription {} added by {}: {} every {}s to {} via {}", subscription.getId(), caller,
                    value, subscription.getPeriodSeconds(), subscription.getDestination(), subscription.getVariant());

            notificationRelay.subscriptionCreated(subscription, treasuryService.vaultAddress());

            if (MoneyUtil.covers(attached, value)
                    || MoneyUtil.covers(treasuryService.balance(), value)
                    || subscription.hasPayload()) {
                settle(caller, subscription, now);
            }

            return subscription.getId();
        });
    }

    @Override
    public void cancelSubscription(String caller, Long subscriptionId) {
        invocations.run(() -> {
            ownerSetService.requireOwner(caller, "cancel subscriptions");
            Subscription subscription = load(subscriptionId);
            Instant now = clock.instant();

            if (subscription.isExpired(now)) {
                throw new StateConflictException("Subscription " + subscriptionId + " already expired at "
                        + subscription.getExpiresAt());
            }

            subscription.setExpiresAt(now);
            subscriptionRepository.save(subscription);

            eventRecorder.record(VaultEventType.SUBSCRIPTION_CANCELLED, subscriptionId, VaultEventPayload.builder()
                    .actor(caller)
                    .subscriptionId(subscriptionId)
                    .build());
            log.info("Subscription {} cancelled by {}", subscriptionId, caller);
        });
    }

    @Override
    public void pauseSubscription(String caller, Long subscriptionId) {
        invocations.run(() -> {
            ownerSetService.requireOwner(caller, "pause subscriptions");
            Subscription subscription = loadActive(subscriptionId);
            if (subscription.isPaused()) {
                throw new StateConflictException("Subscription " + subscriptionId + " is already paused");
            }

            subscription.setPaused(true);
            subscriptionRepository.save(subscription);

            eventRecorder.record(VaultEventType.SUBSCRIPTION_PAUSED, subscriptionId, VaultEventPayload.builder()
                    .actor(caller)
                    .subscriptionId(subscriptionId)
                    .build());
            log.info("Subscription {} paused by {}", subscriptionId, caller);
        });
    }

    @Override
    public void resumeSubscription(String caller, Long subscriptionId) {
        invocations.run(() -> {
            ownerSetService.requireOwner(caller, "resume subscriptions");
            Subscription subscription = loadActive(subscriptionId);
            if (!subscription.isPaused()) {
                throw new StateConflictException("Subscription " + subscriptionId + " is not paused");
            }

            subscription.setPaused(false);
            subscriptionRepository.save(subscription);

            eventRecorder.record(VaultEventType.SUBSCRIPTION_RESUMED, subscriptionId, VaultEventPayload.builder()
                    .actor(caller)
                    .subscriptionId(subscriptionId)
                    .build());
            log.info("Subscription {} resumed by {}", subscriptionId, caller);
        });
    }

    @Override
    public boolean executeSubscription(String caller, Long subscriptionId) {
        return invocations.invoke(() -> {
            authorizeExecutor(caller);
            return settle(caller, load(subscriptionId), clock.instant());
        });
    }

    @Override
    public Subscription getSubscription(Long subscriptionId) {
        return load(subscriptionId);
    }

    private boolean settle(String caller, Subscription subscription, Instant now) {
        Long subscriptionId = subscription.getId();

        if (subscription.isExpired(now)) {
            throw new StateConflictException("Subscription " + subscriptionId + " expired at " + subscription.getExpiresAt());
        }
        if (subscription.isPaused()) {
            throw new StateConflictException("Subscription " + subscriptionId + " is paused");
        }
        if (!subscription.isDue(now)) {
            throw new StateConflictException("Subscription " + subscriptionId + " is not due before "
                    + subscription.getWithdrawNext());
        }

        SettlementStrategy strategy = strategyMap.get(subscription.getVariant());
        if (strategy == null) {
            throw new UnsupportedSettlementVariantException(String.valueOf(subscription.getVariant()));
        }

        String lockKey = IN_FLIGHT_KEY_PREFIX + subscriptionId;
        if (!inFlightLockService.acquire(lockKey)) {
            throw new StateConflictException("Subscription " + subscriptionId + " is already being executed");
        }

        try {
            SettlementResult result = strategy.settle(subscription, treasuryService.vaultAddress());
            return result.success()
                    ? recordSuccess(caller, subscription, now)
                    : recordFailure(caller, subscription, result.failureCode());
        } finally {
            inFlightLockService.release(lockKey);
        }
    }

    private boolean recordSuccess(String caller, Subscription subscription, Instant now) {
        boolean firstCycle = subscription.getCycle() == 0;

        subscription.setWithdrawPrev(now);
        subscription.setCycle(subscription.getCycle() + 1);
        subscription.setWithdrawNext(subscription.getCreatedAt()
                .plus(subscription.getPeriod().multipliedBy(subscription.getCycle())));
        subscriptionRepository.save(subscription);

        eventRecorder.record(VaultEventType.SUBSCRIPTION_EXECUTED, subscription.getId(), VaultEventPayload.builder()
                .actor(caller)
                .subscriptionId(subscription.getId())
                .destination(subscription.getDestination())
                .value(subscription.getValue())
                .cycle(subscription.getCycle())
                .firstCycle(firstCycle)
                .build());
        log.info("Subscription {} executed, cycle {} settled, next withdrawal at {}",
                subscription.getId(), subscription.getCycle(), subscription.getWithdrawNext());

        notificationRelay.paymentExecuted(subscription, firstCycle);
        return true;
    }

    private boolean recordFailure(String caller, Subscription subscription, String reason) {
        eventRecorder.record(VaultEventType.SUBSCRIPTION_EXECUTION_FAILED, subscription.getId(), VaultEventPayload.builder()
                .actor(caller)
                .subscriptionId(subscription.getId())
                .cycle(subscription.getCycle())
                .reason(reason)
                .build());
        log.warn("Subscription {} failed to settle cycle {}: {}", subscription.getId(), subscription.getCycle(), reason);
        return false;
    }

    private void validate(SubscriptionRequest request, Instant now) {
        if (request.destination() == null || request.destination().isBlank()) {
            throw new InvalidValueException("Destination is required");
        }
        if (request.recipient() == null || request.recipient().isBlank()) {
            throw new InvalidValueException("Recipient is required");
        }
        if (!MoneyUtil.isPositive(request.value())) {
            throw new InvalidValueException("Value must be greater than zero");
        }
        if (!MoneyUtil.fitsScale(request.value()) || !MoneyUtil.fitsScale(request.attachedValue())) {
            throw new InvalidValueException("Values allow at most " + MoneyUtil.SCALE + " decimal places");
        }
        if (request.periodSeconds() <= 0) {
            throw new InvalidValueException("Period must be greater than zero");
        }
        if (request.periodSeconds() > Duration.between(now, Subscription.NEVER_EXPIRES).getSeconds()) {
            throw new InvalidValueException("Period of " + request.periodSeconds() + "s reaches past "
                    + Subscription.NEVER_EXPIRES);
        }
        if (request.attachedValue() != null && request.attachedValue().signum() < 0) {
            throw new InvalidValueException("Attached value must not be negative");
        }
        if (request.variant() == null) {
            throw new UnsupportedSettlementVariantException("null");
        }
    }

    // Blank positional fields are stored as empty strings so every position survives persistence
    private static List<String> storedMetadata(List<String> fields) {
        List<String> stored = new ArrayList<>(fields.size());
        for (String field : fields) {
            stored.add(field == null ? "" : field);
        }
        return stored;
    }

    private void authorizeExecutor(String caller) {
        if (ownerSetService.isOwner(caller) || operatorRegistry.isOperator(caller)) {
            return;
        }
        throw new UnauthorizedCallerException(caller, "execute subscriptions");
    }

    private Subscription loadActive(Long subscriptionId) {
        Subscription subscription = load(subscriptionId);
        if (subscription.isExpired(clock.instant())) {
            throw new StateConflictException("Subscription " + subscriptionId + " expired at " + subscription.getExpiresAt());
        }
        return subscription;
    }

    private Subscription load(Long subscriptionId) {
        return subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));
    }
}
