package com.openfashion.vaultservice.gateway;

import com.openfashion.vaultservice.dto.call.ExternalCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
@Slf4j
public class HttpPrincipalTransport implements PrincipalTransport {

    private final RestClient restClient;
    private final String endpointTemplate;

    public HttpPrincipalTransport(RestClient restClient,
                                  @Value("${app.vault.principals.endpoint-template}") String endpointTemplate) {
        this.restClient = restClient;
        this.endpointTemplate = endpointTemplate;
    }

    @Override
    public boolean deliver(ExternalCall call) {
        try {
            // Response body is discarded, only the status matters
            restClient.post()
                    .uri(endpointTemplate, call.to())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(call)
                    .retrieve()
                    .toBodilessEntity();
            return true;
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("Call from {} to {} failed: {}", call.from(), call.to(), e.getMessage());
            return false;
        }
    }
}
