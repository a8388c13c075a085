package com.openfashion.vaultservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "owners")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Owner {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 128)
    private String address;

    // Removal only clears the flag, rows are never deleted
    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private Instant addedAt;

    private Instant removedAt;
}
