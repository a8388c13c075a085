package com.openfashion.vaultservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The referenced row exists but is not in a state that allows the requested transition:
 * already confirmed or executed, not yet due, expired, paused or already executing.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class StateConflictException extends RuntimeException {
    public StateConflictException(String message) {
        super(message);
    }
}
