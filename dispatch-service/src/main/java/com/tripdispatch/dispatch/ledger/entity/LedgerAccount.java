package com.tripdispatch.dispatch.ledger.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Version row per account. Balance-changing transactions bump it first so
 * that concurrent writers for the same account conflict instead of interleaving.
 */
@Entity
@Table(name = "ledger_accounts")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "accountId")
public class LedgerAccount {

    @Id
    @Column(name = "account_id", length = 64)
    private String accountId;

    @Version
    private Long version;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;
}
