package com.openfashion.vaultservice.dto.call;

/**
 * Payload of a transaction addressed to the vault itself.
 */
public record OwnerCommand(
        OwnerCommandType type,
        String owner,
        String newOwner,
        Integer required
) {

    public static OwnerCommand addOwner(String owner) {
        return new OwnerCommand(OwnerCommandType.ADD_OWNER, owner, null, null);
    }

    public static OwnerCommand removeOwner(String owner) {
        return new OwnerCommand(OwnerCommandType.REMOVE_OWNER, owner, null, null);
    }

    public static OwnerCommand replaceOwner(String owner, String newOwner) {
        return new OwnerCommand(OwnerCommandType.REPLACE_OWNER, owner, newOwner, null);
    }

    public static OwnerCommand changeRequirement(int required) {
        return new OwnerCommand(OwnerCommandType.CHANGE_REQUIREMENT, null, null, required);
    }
}
