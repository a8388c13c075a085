package com.openfashion.vaultservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class UnauthorizedCallerException extends RuntimeException {
    public UnauthorizedCallerException(String caller, String action) {
        super("Caller " + caller + " is not allowed to " + action);
    }
}
