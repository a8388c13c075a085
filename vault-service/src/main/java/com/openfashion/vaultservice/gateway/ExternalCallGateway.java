package com.openfashion.vaultservice.gateway;

import java.math.BigDecimal;

/**
 * Outbound call carrying value and an opaque payload from the vault to a principal.
 * <p>
 * Implementations never throw. A rejected, failed or timed-out call is reported as
 * {@code false} and leaves the treasury balance where it was before the call.
 */
public interface ExternalCallGateway {

    boolean call(String destination, BigDecimal value, byte[] payload);
}
