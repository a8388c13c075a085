package com.openfashion.vaultservice;

import com.openfashion.vaultservice.client.registry.OperatorRegistry;
import com.openfashion.vaultservice.core.exceptions.StateConflictException;
import com.openfashion.vaultservice.core.exceptions.UnauthorizedCallerException;
import com.openfashion.vaultservice.dto.SubscriptionRequest;
import com.openfashion.vaultservice.dto.call.OwnerCommand;
import com.openfashion.vaultservice.gateway.OwnerCommandCodec;
import com.openfashion.vaultservice.gateway.PrincipalTransport;
import com.openfashion.vaultservice.model.SettlementVariant;
import com.openfashion.vaultservice.model.Subscription;
import com.openfashion.vaultservice.model.Transaction;
import com.openfashion.vaultservice.model.VaultEventType;
import com.openfashion.vaultservice.repository.VaultEventRepository;
import com.openfashion.vaultservice.service.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.util.TestPropertyValues;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.openfashion.vaultservice.VaultTestConfig.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
@Import(VaultTestConfig.class)
@ContextConfiguration(initializers = VaultIntegrationTest.Initializer.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class VaultIntegrationTest {

    private static final String VAULT = "vault-1";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>("redis:7-alpine").withExposedPorts(6379);

    static class Initializer implements ApplicationContextInitializer<ConfigurableApplicationContext> {
        @Override
        public void initialize(ConfigurableApplicationContext context) {
            TestPropertyValues.of(
                    "spring.datasource.url=" + postgres.getJdbcUrl(),
                    "spring.datasource.username=" + postgres.getUsername(),
                    "spring.datasource.password=" + postgres.getPassword(),
                    "spring.data.redis.host=" + redis.getHost(),
                    "spring.data.redis.port=" + redis.getMappedPort(6379)
            ).applyTo(context.getEnvironment());
        }
    }

    @MockitoBean
    private PrincipalTransport principalTransport;
    @MockitoBean
    private OperatorRegistry operatorRegistry;

    @Autowired
    private TransactionLedgerService transactionLedgerService;
    @Autowired
    private SubscriptionLedgerService subscriptionLedgerService;
    @Autowired
    private OwnerSetService ownerSetService;
    @Autowired
    private TreasuryService treasuryService;
    @Autowired
    private VaultQueryService queryService;
    @Autowired
    private VaultEventRepository eventRepository;
    @Autowired
    private OwnerCommandCodec codec;
    @Autowired
    private MutableClock clock;

    @Test
    @DisplayName("Vault is seeded from configuration on startup")
    void testStartup_Seeded() {
        assertThat(ownerSetService.getOwners()).containsExactly("alice", "bob", "carol");
        assertThat(ownerSetService.getRequired()).isEqualTo(2);
        assertThat(treasuryService.vaultAddress()).isEqualTo(VAULT);
        assertThat(eventRepository.findAllByTypeOrderByIdAsc(VaultEventType.OWNER_ADDED)).hasSize(3);
    }

    @Test
    @DisplayName("Two of three: submitter's confirmation alone does not execute, the second one does")
    void testTransaction_TwoOfThree() {
        treasuryService.deposit("funder", new BigDecimal("50"));
        when(principalTransport.deliver(any())).thenReturn(true);

        Long id = transactionLedgerService.submitTransaction("alice", "merchant", new BigDecimal("10"), null);

        assertThat(transactionLedgerService.getTransaction(id).isExecuted()).isFalse();
        assertThat(transactionLedgerService.getConfirmations(id)).containsExactly("alice");
        verifyNoInteractions(principalTransport);

        transactionLedgerService.confirmTransaction("bob", id);

        assertThat(transactionLedgerService.getTransaction(id).isExecuted()).isTrue();
        assertThat(treasuryService.balance()).isEqualByComparingTo("40");
        assertThat(eventRepository.findAllByTypeOrderByIdAsc(VaultEventType.TRANSACTION_EXECUTED)).hasSize(1);
    }

    @Test
    @DisplayName("Failed call leaves the transaction pending and refunded, a later explicit execute succeeds")
    void testTransaction_FailureThenRetry() {
        treasuryService.deposit("funder", new BigDecimal("50"));
        when(principalTransport.deliver(any())).thenReturn(false, true);

        Long id = transactionLedgerService.submitTransaction("alice", "merchant", new BigDecimal("10"), null);
        transactionLedgerService.confirmTransaction("bob", id);

        assertThat(transactionLedgerService.getTransaction(id).isExecuted()).isFalse();
        assertThat(treasuryService.balance()).isEqualByComparingTo("50");
        assertThat(eventRepository.findAllByTypeOrderByIdAsc(VaultEventType.TRANSACTION_EXECUTION_FAILED)).hasSize(1);

        assertThat(transactionLedgerService.executeTransaction("carol", id)).isTrue();
        assertThat(transactionLedgerService.getTransaction(id).isExecuted()).isTrue();
        assertThat(treasuryService.balance()).isEqualByComparingTo("40");
    }

    @Test
    @DisplayName("A principal calling back into execute during the call is rejected and the value moves once")
    void testTransaction_ReentrantCallback() {
        treasuryService.deposit("funder", new BigDecimal("50"));
        Long id = transactionLedgerService.submitTransaction("alice", "merchant", new BigDecimal("10"), null);

        AtomicReference<RuntimeException> callbackError = new AtomicReference<>();
        when(principalTransport.deliver(any())).thenAnswer(invocation -> {
            try {
                transactionLedgerService.executeTransaction("bob", id);
            } catch (RuntimeException e) {
                callbackError.set(e);
            }
            return true;
        });

        transactionLedgerService.confirmTransaction("bob", id);

        assertThat(callbackError.get()).isInstanceOf(StateConflictException.class);
        assertThat(treasuryService.balance()).isEqualByComparingTo("40");
        verify(principalTransport, times(1)).deliver(any());
    }

    @Test
    @DisplayName("Owner-set functions cannot be called directly by an owner")
    void testOwnerSet_DirectCallRejected() {
        assertThatThrownBy(() -> ownerSetService.addOwner("alice", "dave"))
                .isInstanceOf(UnauthorizedCallerException.class);
        assertThat(ownerSetService.getOwners()).doesNotContain("dave");
    }

    @Test
    @DisplayName("Removing an owner below the threshold lowers it in the same confirmed transaction")
    void testOwnerSet_RemoveClampsThreshold() {
        Long raise = transactionLedgerService.submitTransaction("alice", VAULT, BigDecimal.ZERO,
                codec.encode(OwnerCommand.changeRequirement(3)));
        transactionLedgerService.confirmTransaction("bob", raise);
        assertThat(ownerSetService.getRequired()).isEqualTo(3);

        Long remove = transactionLedgerService.submitTransaction("alice", VAULT, BigDecimal.ZERO,
                codec.encode(OwnerCommand.removeOwner("carol")));
        transactionLedgerService.confirmTransaction("bob", remove);
        assertThat(ownerSetService.getOwners()).contains("carol");

        transactionLedgerService.confirmTransaction("carol", remove);

        assertThat(ownerSetService.getOwners()).containsExactly("alice", "bob");
        assertThat(ownerSetService.getRequired()).isEqualTo(2);
        verifyNoInteractions(principalTransport);
    }

    @Test
    @DisplayName("Invalid owner change through the pipeline fails the transaction and leaves it pending")
    void testOwnerSet_InvalidChangeFails() {
        Long id = transactionLedgerService.submitTransaction("alice", VAULT, BigDecimal.ZERO,
                codec.encode(OwnerCommand.changeRequirement(5)));
        transactionLedgerService.confirmTransaction("bob", id);

        Transaction transaction = transactionLedgerService.getTransaction(id);
        assertThat(transaction.isExecuted()).isFalse();
        assertThat(ownerSetService.getRequired()).isEqualTo(2);
        assertThat(eventRepository.findAllByTypeOrderByIdAsc(VaultEventType.TRANSACTION_EXECUTION_FAILED)).hasSize(1);
    }

    @Test
    @DisplayName("Unfunded subscription is registered without executing")
    void testSubscription_NotFunded() {
        Long id = subscriptionLedgerService.submitSubscription("alice", directEscrow(BigDecimal.ZERO));

        Subscription subscription = subscriptionLedgerService.getSubscription(id);
        assertThat(subscription.getCycle()).isZero();
        assertThat(subscription.getWithdrawNext()).isEqualTo(START);
        assertThat(subscription.getMetadata()).containsExactly("order-1", "", "");
        verifyNoInteractions(principalTransport);
    }

    @Test
    @DisplayName("Null metadata fields survive persistence as empty strings in every position")
    void testSubscription_NullMetadataFields() {
        SubscriptionRequest request = new SubscriptionRequest("merchant", "merchant", new BigDecimal("100"), 30,
                SettlementVariant.DIRECT_ESCROW, null, Arrays.asList("order-1", null, null), BigDecimal.ZERO);

        Long id = subscriptionLedgerService.submitSubscription("alice", request);

        assertThat(subscriptionLedgerService.getSubscription(id).getMetadata()).containsExactly("order-1", "", "");
        assertThat(queryService.getSubscription(id).metadata()).containsExactly("order-1", "", "");
    }

    @Test
    @DisplayName("Attached value settles the first cycle, early execution is rejected, the next period settles again")
    void testSubscription_Recurring() {
        when(principalTransport.deliver(any())).thenReturn(true);
        when(operatorRegistry.isOperator("operator-1")).thenReturn(true);
        treasuryService.deposit("funder", new BigDecimal("100"));

        Long id = subscriptionLedgerService.submitSubscription("alice", directEscrow(new BigDecimal("100")));

        Subscription subscription = subscriptionLedgerService.getSubscription(id);
        assertThat(subscription.getCycle()).isEqualTo(1);
        assertThat(subscription.getWithdrawPrev()).isEqualTo(START);
        assertThat(subscription.getWithdrawNext()).isEqualTo(START.plusSeconds(30));
        assertThat(treasuryService.balance()).isEqualByComparingTo("100");

        clock.advance(Duration.ofSeconds(10));
        assertThatThrownBy(() -> subscriptionLedgerService.executeSubscription("operator-1", id))
                .isInstanceOf(StateConflictException.class);
        assertThat(subscriptionLedgerService.getSubscription(id).getCycle()).isEqualTo(1);

        clock.advance(Duration.ofSeconds(20));
        assertThat(subscriptionLedgerService.executeSubscription("operator-1", id)).isTrue();

        subscription = subscriptionLedgerService.getSubscription(id);
        assertThat(subscription.getCycle()).isEqualTo(2);
        assertThat(subscription.getWithdrawNext()).isEqualTo(START.plusSeconds(60));
        assertThat(treasuryService.balance()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Unknown account cannot execute subscriptions")
    void testSubscription_UnknownExecutor() {
        Long id = subscriptionLedgerService.submitSubscription("alice", directEscrow(BigDecimal.ZERO));

        assertThatThrownBy(() -> subscriptionLedgerService.executeSubscription("mallory", id))
                .isInstanceOf(UnauthorizedCallerException.class);
    }

    @Test
    @DisplayName("Failed settlement leaves the schedule unchanged and the escrow refunded")
    void testSubscription_CallFails() {
        treasuryService.deposit("funder", new BigDecimal("100"));
        when(principalTransport.deliver(any())).thenReturn(false);

        Long id = subscriptionLedgerService.submitSubscription("alice", directEscrow(BigDecimal.ZERO));

        Subscription subscription = subscriptionLedgerService.getSubscription(id);
        assertThat(subscription.getCycle()).isZero();
        assertThat(subscription.getWithdrawPrev()).isNull();
        assertThat(treasuryService.balance()).isEqualByComparingTo("100");
        assertThat(eventRepository.findAllByTypeOrderByIdAsc(VaultEventType.SUBSCRIPTION_EXECUTION_FAILED)).hasSize(1);
    }

    @Test
    @DisplayName("A principal re-entering execution of the same subscription is rejected")
    void testSubscription_ReentrantCallback() {
        Long id = subscriptionLedgerService.submitSubscription("alice", directEscrow(BigDecimal.ZERO));
        treasuryService.deposit("funder", new BigDecimal("200"));

        AtomicReference<RuntimeException> callbackError = new AtomicReference<>();
        when(principalTransport.deliver(any())).thenAnswer(invocation -> {
            try {
                subscriptionLedgerService.executeSubscription("alice", id);
            } catch (RuntimeException e) {
                callbackError.set(e);
            }
            return true;
        });

        assertThat(subscriptionLedgerService.executeSubscription("alice", id)).isTrue();

        assertThat(callbackError.get()).isInstanceOf(StateConflictException.class);
        assertThat(subscriptionLedgerService.getSubscription(id).getCycle()).isEqualTo(1);
        assertThat(treasuryService.balance()).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("Cancelled subscription cannot be executed at any later time")
    void testSubscription_CancelThenExecute() {
        Long id = subscriptionLedgerService.submitSubscription("alice", directEscrow(BigDecimal.ZERO));

        subscriptionLedgerService.cancelSubscription("bob", id);
        clock.advance(Duration.ofDays(30));
        treasuryService.deposit("funder", new BigDecimal("500"));

        assertThatThrownBy(() -> subscriptionLedgerService.executeSubscription("alice", id))
                .isInstanceOf(StateConflictException.class);
        assertThatThrownBy(() -> subscriptionLedgerService.cancelSubscription("alice", id))
                .isInstanceOf(StateConflictException.class);
        verifyNoInteractions(principalTransport);
    }

    private SubscriptionRequest directEscrow(BigDecimal attached) {
        return new SubscriptionRequest("merchant", "merchant", new BigDecimal("100"), 30,
                SettlementVariant.DIRECT_ESCROW, null, List.of("order-1", "", ""), attached);
    }
}
