package com.flagship.media_ledger.ledger;

import lombok.Value;

/**
 * Stored balance compared with the balance recomputed from the ledger.
 */
@Value
public class BalanceAudit {
    String userId;
    long storedBalance;
    long ledgerBalance;

    public boolean isConsistent() {
        return storedBalance == ledgerBalance;
    }
}
