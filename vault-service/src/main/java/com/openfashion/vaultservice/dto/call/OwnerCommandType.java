package com.openfashion.vaultservice.dto.call;

public enum OwnerCommandType {
    ADD_OWNER,
    REMOVE_OWNER,
    REPLACE_OWNER,
    CHANGE_REQUIREMENT
}
