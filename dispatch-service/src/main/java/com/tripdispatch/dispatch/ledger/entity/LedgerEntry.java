package com.tripdispatch.dispatch.ledger.entity;

import com.tripdispatch.dispatch.ledger.model.LedgerEntryStatus;
import com.tripdispatch.dispatch.ledger.model.LedgerEntryType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "ledger_entries",
        indexes = {
                @Index(name = "idx_ledger_account", columnList = "account_id, currency, status"),
                @Index(name = "idx_ledger_trip", columnList = "trip_id"),
                @Index(name = "idx_ledger_related", columnList = "related_entry_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class LedgerEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "account_id", nullable = false)
    private String accountId;

    @Column(name = "trip_id")
    private UUID tripId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, length = 10)
    private LedgerEntryType entryType;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private LedgerEntryStatus status;

    @Column(length = 128)
    private String reference;

    @Column(name = "related_entry_id")
    private UUID relatedEntryId;

    private String description;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
