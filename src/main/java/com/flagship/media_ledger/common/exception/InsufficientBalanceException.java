package com.flagship.media_ledger.common.exception;

import lombok.Getter;

/**
 * Thrown when a debit would take a balance below zero. Nothing has been
 * written when this is thrown.
 */
@Getter
public class InsufficientBalanceException extends RuntimeException {

    private final String userId;
    private final long currentBalance;
    private final long requiredAmount;

    public InsufficientBalanceException(String userId, long currentBalance, long requiredAmount) {
        super(String.format("Insufficient balance for user %s: has %d, needs %d",
                userId, currentBalance, requiredAmount));
        this.userId = userId;
        this.currentBalance = currentBalance;
        this.requiredAmount = requiredAmount;
    }
}
