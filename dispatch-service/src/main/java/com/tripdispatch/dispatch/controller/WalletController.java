package com.tripdispatch.dispatch.controller;

import com.tripdispatch.dispatch.config.TripPolicyProperties;
import com.tripdispatch.dispatch.ledger.LedgerService;
import com.tripdispatch.dispatch.ledger.entity.LedgerEntry;
import com.tripdispatch.dispatch.ledger.model.BalanceView;
import com.tripdispatch.shared.context.IdentityHeaders;
import com.tripdispatch.shared.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/wallets")
@RequiredArgsConstructor
public class WalletController {

    private final LedgerService ledgerService;
    private final TripPolicyProperties tripPolicyProperties;

    @GetMapping("/me/balance")
    public ResponseEntity<ApiResponse<BalanceView>> balance(
            @RequestHeader(IdentityHeaders.USER_ID) String userId,
            @RequestParam(value = "currency", required = false) String currency) {
        String resolved = currency != null ? currency : tripPolicyProperties.getDefaultCurrency();
        return ResponseEntity.ok(ApiResponse.ok(
                new BalanceView(userId, resolved, ledgerService.available(userId, resolved))));
    }

    @GetMapping("/me/entries")
    public ResponseEntity<ApiResponse<List<LedgerEntry>>> entries(
            @RequestHeader(IdentityHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(ApiResponse.ok(ledgerService.recentEntries(userId)));
    }
}
