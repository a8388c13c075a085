package com.openfashion.vaultservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidSubscriptionMetadataException extends RuntimeException {
    public InvalidSubscriptionMetadataException(String message) {
        super("Invalid subscription metadata: " + message);
    }
}
