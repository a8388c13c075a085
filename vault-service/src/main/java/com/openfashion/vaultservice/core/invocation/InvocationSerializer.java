package com.openfashion.vaultservice.core.invocation;

import com.openfashion.vaultservice.model.Vault;
import com.openfashion.vaultservice.repository.VaultRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs every state-mutating vault call to completion before admitting the next one.
 * <p>
 * The outermost call takes the local lock, opens the database transaction and locks the vault
 * row, so invocations are also serialized across service instances sharing the database. A call
 * arriving on a thread that already holds the lock is a callback made by an external principal
 * while the vault is calling out; it joins the running transaction without a template of its
 * own, so a rejected callback surfaces to the principal without marking the outer transaction
 * rollback-only.
 */
@Component
@RequiredArgsConstructor
public class InvocationSerializer {

    private final TransactionTemplate tx;
    private final VaultRepository vaultRepository;
    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T invoke(Supplier<T> action) {
        if (lock.isHeldByCurrentThread()) {
            return action.get();
        }

        lock.lock();
        try {
            return tx.execute(status -> {
                vaultRepository.lockById(Vault.SINGLETON_ID);
                return action.get();
            });
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable action) {
        invoke(() -> {
            action.run();
            return null;
        });
    }
}
