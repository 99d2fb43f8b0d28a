package com.flagship.media_ledger.ledger;

/**
 * Kind of token movement. DEBIT lowers a balance; CREDIT and REFUND raise it.
 */
public enum EntryType {
    DEBIT,
    CREDIT,
    REFUND;

    /**
     * Signed effect of an entry of this type on the owner's balance.
     */
    public long signedAmount(long amount) {
        return this == DEBIT ? -amount : amount;
    }
}
