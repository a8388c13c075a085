package com.openfashion.vaultservice.gateway;

import com.openfashion.vaultservice.dto.call.ExternalCall;

public interface PrincipalTransport {

    /**
     * @return true when the principal accepted the call within the execution budget
     */
    boolean deliver(ExternalCall call);
}
