package com.openfashion.vaultservice.dto;

import com.openfashion.vaultservice.dto.call.OwnerCommandType;
import jakarta.validation.constraints.NotNull;

public record OwnerChangeRequest(
        @NotNull(message = "Change type is required") OwnerCommandType type,
        String owner,
        String newOwner,
        Integer required
) {}
