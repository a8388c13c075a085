package com.openfashion.vaultservice.service.imp;

import com.openfashion.vaultservice.core.exceptions.InvalidOwnerConfigurationException;
import com.openfashion.vaultservice.core.exceptions.OwnerNotFoundException;
import com.openfashion.vaultservice.core.exceptions.UnauthorizedCallerException;
import com.openfashion.vaultservice.core.invocation.InvocationSerializer;
import com.openfashion.vaultservice.dto.event.VaultEventPayload;
import com.openfashion.vaultservice.model.Owner;
import com.openfashion.vaultservice.model.Vault;
import com.openfashion.vaultservice.model.VaultEventType;
import com.openfashion.vaultservice.repository.OwnerRepository;
import com.openfashion.vaultservice.repository.VaultRepository;
import com.openfashion.vaultservice.service.OwnerSetService;
import com.openfashion.vaultservice.service.TreasuryService;
import com.openfashion.vaultservice.service.VaultEventRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class OwnerSetServiceImp implements OwnerSetService {

    private final OwnerRepository ownerRepository;
    private final VaultRepository vaultRepository;
    private final TreasuryService treasuryService;
    private final VaultEventRecorder eventRecorder;
    private final InvocationSerializer invocations;
    private final Clock clock;

    @Override
    public List<String> getOwners() {
        return ownerRepository.findAllByActiveTrueOrderByIdAsc().stream()
                .map(Owner::getAddress)
                .toList();
    }

    @Override
    public boolean isOwner(String address) {
        return address != null && ownerRepository.existsByAddressAndActiveTrue(address);
    }

    @Override
    public int getRequired() {
        return treasuryService.loadVault().getRequired();
    }

    @Override
    public void requireOwner(String caller, String action) {
        if (!isOwner(caller)) {
            throw new UnauthorizedCallerException(caller, action);
        }
    }

    @Override
    public void initialize(String address, List<String> owners, int required) {
        invocations.run(() -> {
            if (vaultRepository.existsById(Vault.SINGLETON_ID)) {
                log.info("Vault already initialized, keeping the stored owner set");
                return;
            }

            if (address == null || address.isBlank()) {
                throw new InvalidOwnerConfigurationException("Vault address is required");
            }

            Set<String> unique = new LinkedHashSet<>();
            for (String owner : owners) {
                validateCandidate(owner, address);
                if (!unique.add(owner)) {
                    throw new InvalidOwnerConfigurationException("Duplicate owner: " + owner);
                }
            }
            validateRequirement(unique.size(), required);

            vaultRepository.save(Vault.builder()
                    .id(Vault.SINGLETON_ID)
                    .address(address)
                    .required(required)
                    .build());

            for (String owner : unique) {
                activate(owner);
                eventRecorder.record(VaultEventType.OWNER_ADDED, owner, VaultEventPayload.builder()
                        .actor(address)
                        .owner(owner)
                        .build());
            }
            eventRecorder.record(VaultEventType.REQUIREMENT_CHANGED, address, VaultEventPayload.builder()
                    .actor(address)
                    .required(required)
                    .build());

            log.info("Vault {} initialized with {} owners, {} confirmations required", address, unique.size(), required);
        });
    }

    @Override
    public void addOwner(String caller, String owner) {
        invocations.run(() -> {
            Vault vault = requireSelf(caller, "add owners");
            validateCandidate(owner, vault.getAddress());
            if (isOwner(owner)) {
                throw new InvalidOwnerConfigurationException("Already an owner: " + owner);
            }
            validateRequirement(ownerRepository.countByActiveTrue() + 1, vault.getRequired());

            activate(owner);
            eventRecorder.record(VaultEventType.OWNER_ADDED, owner, VaultEventPayload.builder()
                    .actor(caller)
                    .owner(owner)
                    .build());
            log.info("Owner {} added", owner);
        });
    }

    @Override
    public void removeOwner(String caller, String owner) {
        invocations.run(() -> {
            Vault vault = requireSelf(caller, "remove owners");
            if (!isOwner(owner)) {
                throw new OwnerNotFoundException(owner);
            }

            long remaining = ownerRepository.countByActiveTrue() - 1;
            if (remaining < 1) {
                throw new InvalidOwnerConfigurationException("Cannot remove the last owner");
            }

            deactivate(owner);
            eventRecorder.record(VaultEventType.OWNER_REMOVED, owner, VaultEventPayload.builder()
                    .actor(caller)
                    .owner(owner)
                    .build());
            log.info("Owner {} removed", owner);

            if (vault.getRequired() > remaining) {
                applyRequirement(vault, (int) remaining, caller);
            }
        });
    }

    @Override
    public void replaceOwner(String caller, String owner, String newOwner) {
        invocations.run(() -> {
            Vault vault = requireSelf(caller, "replace owners");
            if (!isOwner(owner)) {
                throw new OwnerNotFoundException(owner);
            }
            validateCandidate(newOwner, vault.getAddress());
            if (isOwner(newOwner)) {
                throw new InvalidOwnerConfigurationException("Already an owner: " + newOwner);
            }

            deactivate(owner);
            activate(newOwner);
            eventRecorder.record(VaultEventType.OWNER_REMOVED, owner, VaultEventPayload.builder()
                    .actor(caller)
                    .owner(owner)
                    .build());
            eventRecorder.record(VaultEventType.OWNER_ADDED, newOwner, VaultEventPayload.builder()
                    .actor(caller)
                    .owner(newOwner)
                    .build());
            log.info("Owner {} replaced by {}", owner, newOwner);
        });
    }

    @Override
    public void changeRequirement(String caller, int required) {
        invocations.run(() -> {
            Vault vault = requireSelf(caller, "change the requirement");
            validateRequirement(ownerRepository.countByActiveTrue(), required);
            applyRequirement(vault, required, caller);
        });
    }

    private Vault requireSelf(String caller, String action) {
        Vault vault = treasuryService.loadVault();
        if (!vault.getAddress().equals(caller)) {
            throw new UnauthorizedCallerException(caller, action);
        }
        return vault;
    }

    private void applyRequirement(Vault vault, int required, String actor) {
        vault.setRequired(required);
        vaultRepository.save(vault);
        eventRecorder.record(VaultEventType.REQUIREMENT_CHANGED, vault.getAddress(), VaultEventPayload.builder()
                .actor(actor)
                .required(required)
                .build());
        log.info("Requirement changed to {}", required);
    }

    private void activate(String address) {
        Owner owner = ownerRepository.findByAddress(address)
                .orElseGet(() -> Owner.builder().address(address).build());
        owner.setActive(true);
        owner.setAddedAt(clock.instant());
        owner.setRemovedAt(null);
        ownerRepository.save(owner);
    }

    private void deactivate(String address) {
        Owner owner = ownerRepository.findByAddress(address)
                .orElseThrow(() -> new OwnerNotFoundException(address));
        owner.setActive(false);
        owner.setRemovedAt(clock.instant());
        ownerRepository.save(owner);
    }

    private void validateCandidate(String owner, String vaultAddress) {
        if (owner == null || owner.isBlank()) {
            throw new InvalidOwnerConfigurationException("Owner address is required");
        }
        if (owner.equals(vaultAddress)) {
            throw new InvalidOwnerConfigurationException("The vault cannot be its own owner");
        }
    }

    private void validateRequirement(long ownerCount, int required) {
        if (ownerCount > MAX_OWNER_COUNT
                || ownerCount < 1
                || required < 1
                || required > ownerCount) {
            throw new InvalidOwnerConfigurationException(
                    String.format("Requirement of %d with %d owners is not allowed", required, ownerCount));
        }
    }
}
