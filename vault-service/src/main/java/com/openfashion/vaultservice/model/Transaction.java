package com.openfashion.vaultservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "transactions", indexes = {
        @Index(name = "idx_transactions_executed", columnList = "executed")
})
public class Transaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 256)
    private String destination;

    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal value;

    @Column(length = 65_536)
    private byte[] payload;

    @Column(nullable = false)
    private boolean executed;

    @Column(nullable = false, length = 128)
    private String submittedBy;

    @Column(nullable = false)
    private Instant createdAt;

    @Version
    private Long version;
}
