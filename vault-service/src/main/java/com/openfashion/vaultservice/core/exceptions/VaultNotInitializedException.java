package com.openfashion.vaultservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class VaultNotInitializedException extends RuntimeException {
    public VaultNotInitializedException() {
        super("Vault has not been initialized");
    }
}
