package com.openfashion.vaultservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class UnsupportedSettlementVariantException extends RuntimeException {
    public UnsupportedSettlementVariantException(String variant) {
        super("Unsupported settlement variant: " + variant);
    }
}
