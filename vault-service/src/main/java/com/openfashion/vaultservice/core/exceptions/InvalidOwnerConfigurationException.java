package com.openfashion.vaultservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidOwnerConfigurationException extends RuntimeException {
    public InvalidOwnerConfigurationException(String message) {
        super(message);
    }
}
