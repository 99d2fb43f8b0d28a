package com.flagship.media_ledger.ledger;

import com.flagship.media_ledger.ledger.dto.BalanceResponse;
import com.flagship.media_ledger.ledger.dto.LedgerEntryResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only views of a user's tokens. Balances only change through
 * creations, stitch jobs and payment webhooks.
 */
@RestController
@RequestMapping("/api/users/{userId}")
@RequiredArgsConstructor
public class LedgerController {

    private static final int MAX_HISTORY = 200;

    private final TokenLedgerService ledgerService;

    @GetMapping("/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(new BalanceResponse(userId, ledgerService.getBalance(userId)));
    }

    @GetMapping("/ledger")
    public ResponseEntity<List<LedgerEntryResponse>> getHistory(
            @PathVariable("userId") String userId,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        List<LedgerEntryResponse> entries = ledgerService.getHistory(userId, Math.min(limit, MAX_HISTORY))
            .stream()
            .map(LedgerEntryResponse::from)
            .toList();
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/balance/audit")
    public ResponseEntity<BalanceAudit> audit(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(ledgerService.verifyBalance(userId));
    }
}
