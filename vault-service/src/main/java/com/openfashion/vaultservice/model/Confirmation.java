package com.openfashion.vaultservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "confirmations",
        uniqueConstraints = @UniqueConstraint(columnNames = {"transaction_id", "owner"}),
        indexes = @Index(name = "idx_confirmations_transaction_id", columnList = "transaction_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Confirmation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_id", nullable = false)
    private Long transactionId;

    @Column(nullable = false, length = 128)
    private String owner;

    // Revocation clears the flag and keeps the row
    @Column(nullable = false)
    private boolean confirmed;

    @Column(nullable = false)
    private Instant updatedAt;
}
