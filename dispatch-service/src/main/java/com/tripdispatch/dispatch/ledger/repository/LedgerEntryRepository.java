package com.tripdispatch.dispatch.ledger.repository;

import com.tripdispatch.dispatch.ledger.entity.LedgerEntry;
import com.tripdispatch.dispatch.ledger.model.LedgerEntryStatus;
import com.tripdispatch.dispatch.ledger.model.LedgerEntryType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, UUID> {

    @Query("""
            SELECT COALESCE(SUM(e.amount), 0) FROM LedgerEntry e
            WHERE e.accountId = :accountId
              AND e.currency = :currency
              AND e.status = :status
              AND e.entryType IN :types
            """)
    BigDecimal sumAmount(@Param("accountId") String accountId,
                         @Param("currency") String currency,
                         @Param("status") LedgerEntryStatus status,
                         @Param("types") Collection<LedgerEntryType> types);

    boolean existsByRelatedEntryIdAndEntryTypeIn(UUID relatedEntryId, Collection<LedgerEntryType> types);

    boolean existsByAccountIdAndReferenceAndEntryType(String accountId, String reference, LedgerEntryType type);

    List<LedgerEntry> findByTripIdOrderByCreatedAtAsc(UUID tripId);

    List<LedgerEntry> findTop100ByAccountIdOrderByCreatedAtDesc(String accountId);
}
