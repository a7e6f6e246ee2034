package com.tripdispatch.dispatch.ledger.repository;

import com.tripdispatch.dispatch.ledger.entity.LedgerAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LedgerAccountRepository extends JpaRepository<LedgerAccount, String> {
}
