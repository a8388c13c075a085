package com.openfashion.vaultservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Data
@Builder
@Table(name = "vault_events", indexes = {
        @Index(name = "idx_vault_events_status", columnList = "status")
})
@AllArgsConstructor
@NoArgsConstructor
public class VaultEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    @Enumerated(EnumType.STRING)
    private VaultEventType type;

    @Column(nullable = false, length = 256)
    private String aggregateId;

    @Column(nullable = false, length = 4000)
    private String payload;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OutboxStatus status;

    @Column(nullable = false)
    private Instant createdAt;
}
