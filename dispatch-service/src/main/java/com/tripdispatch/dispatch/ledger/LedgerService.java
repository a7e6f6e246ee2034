package com.tripdispatch.dispatch.ledger;

import com.tripdispatch.dispatch.exception.DispatchException;
import com.tripdispatch.dispatch.exception.ErrorCode;
import com.tripdispatch.dispatch.ledger.entity.LedgerAccount;
import com.tripdispatch.dispatch.ledger.entity.LedgerEntry;
import com.tripdispatch.dispatch.ledger.model.LedgerEntryStatus;
import com.tripdispatch.dispatch.ledger.model.LedgerEntryType;
import com.tripdispatch.dispatch.ledger.repository.LedgerAccountRepository;
import com.tripdispatch.dispatch.ledger.repository.LedgerEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Append-only wallet ledger.
 *
 * available = sum(CREDIT + REFUND) - sum(DEBIT + HOLD), over COMPLETED entries.
 *
 * A hold is settled once: captured (hold VOIDED, DEBIT of the final fare
 * appended) or reversed (REFUND of the hold amount appended). Both settlements
 * reference the hold through {@code relatedEntryId}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {

    private final LedgerEntryRepository entryRepository;
    private final LedgerAccountRepository accountRepository;
    private final Clock clock;

    public BigDecimal available(String accountId, String currency) {
        BigDecimal in = entryRepository.sumAmount(accountId, currency,
                LedgerEntryStatus.COMPLETED, LedgerEntryType.INFLOWS);
        BigDecimal out = entryRepository.sumAmount(accountId, currency,
                LedgerEntryStatus.COMPLETED, LedgerEntryType.OUTFLOWS);
        return in.subtract(out);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> recentEntries(String accountId) {
        return entryRepository.findTop100ByAccountIdOrderByCreatedAtDesc(accountId);
    }

    /**
     * Bumps the account's version row. Two transactions touching the same
     * account cannot both commit.
     */
    @Transactional
    public void touch(String accountId) {
        LedgerAccount account = accountRepository.findById(accountId)
                .orElseGet(() -> LedgerAccount.builder().accountId(accountId).build());
        account.setLastActivityAt(clock.instant());
        accountRepository.saveAndFlush(account);
    }

    @Transactional
    public LedgerEntry placeHold(String accountId, UUID tripId, BigDecimal amount, String currency) {
        LedgerEntry hold = append(accountId, tripId, LedgerEntryType.HOLD, amount, currency,
                "hold_" + tripId, null, "Trip fare hold");
        log.info("Hold {} of {} {} placed on account {} for trip {}", hold.getId(), amount, currency, accountId, tripId);
        return hold;
    }

    /**
     * Settles a hold against the final fare. Returns false when the hold was
     * already settled.
     */
    @Transactional
    public boolean captureHold(UUID holdId, BigDecimal finalFare) {
        LedgerEntry hold = loadHold(holdId);
        if (isSettled(holdId)) {
            log.info("Hold {} already settled, capture skipped", holdId);
            return false;
        }
        touch(hold.getAccountId());

        hold.setStatus(LedgerEntryStatus.VOIDED);
        entryRepository.save(hold);
        append(hold.getAccountId(), hold.getTripId(), LedgerEntryType.DEBIT, finalFare, hold.getCurrency(),
                "fare_" + hold.getTripId(), holdId, "Trip fare");
        log.info("Hold {} captured for {} {}", holdId, finalFare, hold.getCurrency());
        return true;
    }

    /**
     * Releases a hold in full. A positive {@code fee} is charged as a separate
     * DEBIT. Returns false when the hold was already settled.
     */
    @Transactional
    public boolean reverseHold(UUID holdId, BigDecimal fee) {
        LedgerEntry hold = loadHold(holdId);
        if (isSettled(holdId)) {
            log.info("Hold {} already settled, reversal skipped", holdId);
            return false;
        }
        touch(hold.getAccountId());

        append(hold.getAccountId(), hold.getTripId(), LedgerEntryType.REFUND, hold.getAmount(), hold.getCurrency(),
                "refund_" + hold.getTripId(), holdId, "Trip hold released");
        if (fee != null && fee.signum() > 0) {
            append(hold.getAccountId(), hold.getTripId(), LedgerEntryType.DEBIT, fee, hold.getCurrency(),
                    "cancel_fee_" + hold.getTripId(), null, "Cancellation fee");
        }
        log.info("Hold {} reversed ({} {}), fee={}", holdId, hold.getAmount(), hold.getCurrency(), fee);
        return true;
    }

    @Transactional
    public LedgerEntry append(String accountId, UUID tripId, LedgerEntryType type, BigDecimal amount,
                              String currency, String reference, UUID relatedEntryId, String description) {
        if (amount == null || amount.signum() < 0) {
            throw new DispatchException(ErrorCode.INVALID_REQUEST, "Ledger amount must not be negative");
        }
        LedgerEntry entry = LedgerEntry.builder()
                .accountId(accountId)
                .tripId(tripId)
                .entryType(type)
                .amount(amount)
                .currency(currency)
                .status(LedgerEntryStatus.COMPLETED)
                .reference(reference)
                .relatedEntryId(relatedEntryId)
                .description(description)
                .build();
        return entryRepository.save(entry);
    }

    public boolean hasEntry(String accountId, String reference, LedgerEntryType type) {
        return entryRepository.existsByAccountIdAndReferenceAndEntryType(accountId, reference, type);
    }

    public boolean isSettled(UUID holdId) {
        return entryRepository.existsByRelatedEntryIdAndEntryTypeIn(holdId, LedgerEntryType.SETTLEMENTS);
    }

    private LedgerEntry loadHold(UUID holdId) {
        LedgerEntry hold = entryRepository.findById(holdId)
                .orElseThrow(() -> new IllegalStateException("Hold " + holdId + " does not exist"));
        if (hold.getEntryType() != LedgerEntryType.HOLD) {
            throw new IllegalStateException("Ledger entry " + holdId + " is not a hold");
        }
        return hold;
    }
}
