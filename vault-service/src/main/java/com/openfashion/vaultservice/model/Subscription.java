package com.openfashion.vaultservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "subscriptions")
public class Subscription {

    public static final Instant NEVER_EXPIRES = Instant.parse("9999-12-31T23:59:59Z");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 256)
    private String destination;

    @Column(nullable = false, length = 256)
    private String recipient;

    // Funding source for DELEGATED_ALLOWANCE
    @Column(length = 256)
    private String wallet;

    @Column(length = 256)
    private String token;

    @Column(name = "amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal value;

    @Column(nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private SettlementVariant variant;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant expiresAt;

    @Column(name = "cycle_count", nullable = false)
    private long cycle;

    @Column(nullable = false)
    private long periodSeconds;

    private Instant withdrawPrev;

    @Column(nullable = false)
    private Instant withdrawNext;

    @Column(nullable = false, length = 256)
    private String externalId;

    @Column(length = 65_536)
    private byte[] payload;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "subscription_metadata", joinColumns = @JoinColumn(name = "subscription_id"))
    @OrderColumn(name = "field_index")
    @Column(name = "field", length = 512)
    @Builder.Default
    private List<String> metadata = new ArrayList<>();

    @Column(nullable = false)
    private boolean paused;

    @Column(nullable = false, length = 128)
    private String submittedBy;

    public Duration getPeriod() {
        return Duration.ofSeconds(periodSeconds);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(withdrawNext);
    }

    public boolean isWithdrawable(Instant now) {
        return !isExpired(now) && !paused && isDue(now);
    }

    public boolean hasPayload() {
        return payload != null && payload.length > 0;
    }
}
