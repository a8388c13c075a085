package com.openfashion.vaultservice;

import com.openfashion.vaultservice.client.token.TokenCollaborator;
import com.openfashion.vaultservice.client.token.TokenGatewayClient;
import com.openfashion.vaultservice.dto.call.TokenTransferCommand;
import com.openfashion.vaultservice.gateway.ExternalCallGateway;
import com.openfashion.vaultservice.model.SettlementVariant;
import com.openfashion.vaultservice.model.Subscription;
import com.openfashion.vaultservice.service.TreasuryService;
import com.openfashion.vaultservice.service.strategy.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SettlementStrategyTest {

    private static final String VAULT = "vault-1";

    @Mock
    private TreasuryService treasuryService;
    @Mock
    private ExternalCallGateway externalCallGateway;
    @Mock
    private TokenCollaborator tokenCollaborator;

    private Subscription subscription;

    @BeforeEach
    void setUp() {
        subscription = Subscription.builder()
                .id(3L)
                .destination("merchant")
                .recipient("merchant-wallet")
                .wallet("payer-wallet")
                .token("token-usd")
                .value(new BigDecimal("25.0000"))
                .createdAt(Instant.EPOCH)
                .expiresAt(Subscription.NEVER_EXPIRES)
                .withdrawNext(Instant.EPOCH)
                .periodSeconds(60)
                .externalId("order-3")
                .payload("invoice-3".getBytes())
                .build();
    }

    @Test
    @DisplayName("Direct escrow: insufficient balance fails without calling out")
    void testDirectEscrow_InsufficientBalance() {
        DirectEscrowSettlementStrategy strategy = new DirectEscrowSettlementStrategy(treasuryService, externalCallGateway);
        when(treasuryService.balance()).thenReturn(new BigDecimal("10"));

        SettlementResult result = strategy.settle(subscription, VAULT);

        assertThat(result.success()).isFalse();
        assertThat(result.failureCode()).isEqualTo(SettlementResult.INSUFFICIENT_ESCROW_BALANCE);
        verifyNoInteractions(externalCallGateway);
    }

    @Test
    @DisplayName("Direct escrow: value and payload go to the destination")
    void testDirectEscrow_Success() {
        DirectEscrowSettlementStrategy strategy = new DirectEscrowSettlementStrategy(treasuryService, externalCallGateway);
        when(treasuryService.balance()).thenReturn(new BigDecimal("25"));
        when(externalCallGateway.call("merchant", subscription.getValue(), subscription.getPayload())).thenReturn(true);

        assertThat(strategy.settle(subscription, VAULT).success()).isTrue();
    }

    @Test
    @DisplayName("Direct escrow: rejected call is reported as a failure")
    void testDirectEscrow_CallFails() {
        DirectEscrowSettlementStrategy strategy = new DirectEscrowSettlementStrategy(treasuryService, externalCallGateway);
        when(treasuryService.balance()).thenReturn(new BigDecimal("100"));
        when(externalCallGateway.call(any(), any(), any())).thenReturn(false);

        SettlementResult result = strategy.settle(subscription, VAULT);

        assertThat(result.failureCode()).isEqualTo(SettlementResult.EXTERNAL_CALL_FAILED);
    }

    @Test
    @DisplayName("Escrow token: vault is the funding source")
    void testEscrowToken_FromVault() {
        EscrowTokenSettlementStrategy strategy = new EscrowTokenSettlementStrategy(tokenCollaborator);
        when(tokenCollaborator.transferOnBehalf("token-usd", VAULT, "merchant-wallet", subscription.getValue()))
                .thenReturn(true);

        assertThat(strategy.supports(SettlementVariant.ESCROW_TOKEN)).isTrue();
        assertThat(strategy.settle(subscription, VAULT).success()).isTrue();
    }

    @Test
    @DisplayName("Delegated allowance: settlement wallet is the funding source")
    void testDelegatedAllowance_FromWallet() {
        DelegatedAllowanceSettlementStrategy strategy = new DelegatedAllowanceSettlementStrategy(tokenCollaborator);
        when(tokenCollaborator.transferOnBehalf("token-usd", "payer-wallet", "merchant-wallet", subscription.getValue()))
                .thenReturn(false);

        SettlementResult result = strategy.settle(subscription, VAULT);

        assertThat(strategy.supports(SettlementVariant.DELEGATED_ALLOWANCE)).isTrue();
        assertThat(strategy.supports(SettlementVariant.DIRECT_ESCROW)).isFalse();
        assertThat(result.failureCode()).isEqualTo(SettlementResult.TOKEN_TRANSFER_FAILED);
    }

    @Test
    @DisplayName("Token client: transfer is encoded as a zero-value call to the token")
    void testTokenClient_EncodesTransfer() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        TokenGatewayClient client = new TokenGatewayClient(externalCallGateway, objectMapper);
        when(externalCallGateway.call(eq("token-usd"), eq(BigDecimal.ZERO), any())).thenReturn(true);

        boolean accepted = client.transferOnBehalf("token-usd", "payer-wallet", "merchant-wallet", new BigDecimal("25"));

        ArgumentCaptor<byte[]> payload = ArgumentCaptor.forClass(byte[].class);
        verify(externalCallGateway).call(eq("token-usd"), eq(BigDecimal.ZERO), payload.capture());
        TokenTransferCommand command = objectMapper.readValue(payload.getValue(), TokenTransferCommand.class);

        assertThat(accepted).isTrue();
        assertThat(command.operation()).isEqualTo(TokenTransferCommand.TRANSFER_ON_BEHALF);
        assertThat(command.from()).isEqualTo("payer-wallet");
        assertThat(command.to()).isEqualTo("merchant-wallet");
        assertThat(command.value()).isEqualByComparingTo("25");
    }
}
