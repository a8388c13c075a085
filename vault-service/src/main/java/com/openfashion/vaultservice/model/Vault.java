package com.openfashion.vaultservice.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.Digits;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Entity
@Table(name = "vault")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vault {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    // Principal identifier the vault uses when it calls out, and when it calls itself
    @Column(nullable = false, unique = true, length = 128)
    private String address;

    @Column(name = "required_confirmations", nullable = false)
    private int required;

    @Column(nullable = false, precision = 19, scale = 4)
    @Digits(integer = 15, fraction = 4, message = "Balance exceeds 15 integer digits or 4 decimal places")
    @Builder.Default
    private BigDecimal balance = BigDecimal.ZERO;

    @Version
    private Long version;
}
