package com.openfashion.vaultservice.repository;

import com.openfashion.vaultservice.model.Transaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    List<Transaction> findAllByOrderByIdAsc();

    long countByExecuted(boolean executed);
}
