package com.openfashion.vaultservice.gateway;

import com.openfashion.vaultservice.core.exceptions.InvalidOwnerConfigurationException;
import com.openfashion.vaultservice.dto.call.OwnerCommand;
import com.openfashion.vaultservice.service.OwnerSetService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;

/**
 * Applies an owner-set command carried by a transaction the vault addressed to itself.
 * The vault address is passed as the caller, which is the only identity the owner-set
 * mutations accept.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SelfCallHandler {

    private final OwnerSetService ownerSetService;
    private final OwnerCommandCodec codec;

    public boolean handle(String vaultAddress, byte[] payload) {
        if (payload == null || payload.length == 0) {
            return true;
        }

        OwnerCommand command;
        try {
            command = codec.decode(payload);
        } catch (JacksonException e) {
            log.warn("Self call carried an undecodable payload: {}", e.getMessage());
            return false;
        }

        try {
            apply(vaultAddress, command);
            return true;
        } catch (RuntimeException e) {
            log.warn("Self call {} rejected: {}", command.type(), e.getMessage());
            return false;
        }
    }

    private void apply(String self, OwnerCommand command) {
        if (command.type() == null) {
            throw new InvalidOwnerConfigurationException("Owner command type is missing");
        }

        switch (command.type()) {
            case ADD_OWNER -> ownerSetService.addOwner(self, command.owner());
            case REMOVE_OWNER -> ownerSetService.removeOwner(self, command.owner());
            case REPLACE_OWNER -> ownerSetService.replaceOwner(self, command.owner(), command.newOwner());
            case CHANGE_REQUIREMENT -> {
                if (command.required() == null) {
                    throw new InvalidOwnerConfigurationException("Required confirmations are missing");
                }
                ownerSetService.changeRequirement(self, command.required());
            }
        }
    }
}
