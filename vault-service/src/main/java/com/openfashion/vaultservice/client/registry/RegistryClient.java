package com.openfashion.vaultservice.client.registry;

import com.openfashion.vaultservice.client.registry.dto.NewSubscriptionNotice;
import com.openfashion.vaultservice.client.registry.dto.OperatorStatus;
import com.openfashion.vaultservice.client.registry.dto.PaymentNotice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
@Slf4j
public class RegistryClient implements OperatorRegistry {

    private final RestClient restClient;

    public RegistryClient(RestClient restClient,
                          @Value("${app.vault.registry.url:}") String registryUrl) {
        this.restClient = registryUrl == null || registryUrl.isBlank()
                ? null
                : restClient.mutate().baseUrl(registryUrl).build();
    }

    @Override
    public boolean isConfigured() {
        return restClient != null;
    }

    @Override
    public boolean isOperator(String account) {
        if (!isConfigured() || account == null) {
            return false;
        }

        try {
            OperatorStatus status = restClient.get()
                    .uri("/operators/{account}", account)
                    .retrieve()
                    .body(OperatorStatus.class);
            return status != null && status.operator();
        } catch (RestClientException e) {
            log.warn("Operator lookup for {} failed, treating as not authorized: {}", account, e.getMessage());
            return false;
        }
    }

    @Override
    public void handleNewSubscription(String destination, String vaultId, Long subscriptionId, String externalId) {
        restClient.post()
                .uri("/subscriptions")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new NewSubscriptionNotice(destination, vaultId, subscriptionId, externalId))
                .retrieve()
                .toBodilessEntity();
    }

    @Override
    public void handlePaymentNotification(String destination, Long subscriptionId, String externalId, boolean firstCycle) {
        restClient.post()
                .uri("/subscriptions/{id}/payments", subscriptionId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new PaymentNotice(destination, subscriptionId, externalId, firstCycle))
                .retrieve()
                .toBodilessEntity();
    }
}
