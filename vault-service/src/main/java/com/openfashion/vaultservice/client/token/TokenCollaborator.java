package com.openfashion.vaultservice.client.token;

import java.math.BigDecimal;

public interface TokenCollaborator {

    /**
     * Asks {@code token} to move {@code value} from {@code from} to {@code to} on the vault's behalf.
     *
     * @return false when the token refused or could not be reached
     */
    boolean transferOnBehalf(String token, String from, String to, BigDecimal value);
}
