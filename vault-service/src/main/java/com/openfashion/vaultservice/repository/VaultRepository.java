package com.openfashion.vaultservice.repository;

import com.openfashion.vaultservice.model.Vault;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VaultRepository extends JpaRepository<Vault, Long> {

    // SELECT ... FOR UPDATE on the singleton row, held until the invocation commits
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Vault v WHERE v.id = :id")
    Optional<Vault> lockById(@Param("id") Long id);
}
