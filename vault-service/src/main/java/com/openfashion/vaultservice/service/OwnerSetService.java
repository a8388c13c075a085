package com.openfashion.vaultservice.service;

import java.util.List;

/**
 * Quorum membership and the number of confirmations a transaction needs.
 * <p>
 * The mutating operations take the caller explicitly and only accept the vault's own address,
 * which is the identity a confirmed transaction carries when the vault calls itself.
 */
public interface OwnerSetService {

    int MAX_OWNER_COUNT = 50;

    List<String> getOwners();

    boolean isOwner(String address);

    int getRequired();

    void requireOwner(String caller, String action);

    void initialize(String address, List<String> owners, int required);

    void addOwner(String caller, String owner);

    void removeOwner(String caller, String owner);

    void replaceOwner(String caller, String owner, String newOwner);

    void changeRequirement(String caller, int required);
}
