package com.openfashion.vaultservice.repository;

import com.openfashion.vaultservice.model.Confirmation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConfirmationRepository extends JpaRepository<Confirmation, Long> {

    Optional<Confirmation> findByTransactionIdAndOwner(Long transactionId, String owner);

    List<Confirmation> findAllByTransactionIdAndConfirmedTrue(Long transactionId);
}
