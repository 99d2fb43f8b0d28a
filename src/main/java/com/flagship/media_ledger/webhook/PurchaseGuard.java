package com.flagship.media_ledger.webhook;

import com.flagship.media_ledger.ledger.TokenLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Checks a purchase before its tokens are credited: the claimed package
 * must match the catalogue and the buyer must be under the purchase rate
 * ceilings. Rate limits fail open when they cannot be evaluated.
 */
@Component
@Slf4j
public class PurchaseGuard {

    private final TokenLedgerService ledgerService;
    private final Clock clock;
    private final int maxPerHour;
    private final int maxPerDay;
    private final long maxTokensPerPurchase;

    public PurchaseGuard(TokenLedgerService ledgerService,
                         Clock clock,
                         @Value("${webhook.abuse.max-credits-per-hour:5}") int maxPerHour,
                         @Value("${webhook.abuse.max-credits-per-day:20}") int maxPerDay,
                         @Value("${webhook.abuse.max-tokens-per-purchase:10000}") long maxTokensPerPurchase) {
        this.ledgerService = ledgerService;
        this.clock = clock;
        this.maxPerHour = maxPerHour;
        this.maxPerDay = maxPerDay;
        this.maxTokensPerPurchase = maxTokensPerPurchase;
    }

    /**
     * @param claimedTokens token count carried in the event metadata, if any
     * @param amountPaidCents amount charged by the provider, if reported
     */
    public Optional<GuardViolation> check(String userId, TokenPackage tokenPackage,
                                          Long claimedTokens, Long amountPaidCents) {
        if (claimedTokens != null && claimedTokens != tokenPackage.getTokens()) {
            return Optional.of(new GuardViolation(GuardViolation.TOKEN_MISMATCH, String.format(
                "Package %s grants %d tokens, event claimed %d",
                tokenPackage.getId(), tokenPackage.getTokens(), claimedTokens)));
        }
        if (amountPaidCents != null && amountPaidCents != tokenPackage.getPriceCents()) {
            return Optional.of(new GuardViolation(GuardViolation.PRICE_MISMATCH, String.format(
                "Package %s costs %d cents, event paid %d",
                tokenPackage.getId(), tokenPackage.getPriceCents(), amountPaidCents)));
        }
        if (tokenPackage.getTokens() > maxTokensPerPurchase) {
            return Optional.of(new GuardViolation(GuardViolation.EXCESSIVE_AMOUNT, String.format(
                "Package %s grants %d tokens, maximum per purchase is %d",
                tokenPackage.getId(), tokenPackage.getTokens(), maxTokensPerPurchase)));
        }
        return checkRate(userId);
    }

    private Optional<GuardViolation> checkRate(String userId) {
        Instant now = clock.instant();
        long lastHour;
        long lastDay;
        try {
            lastHour = ledgerService.countCreditsSince(userId, now.minus(Duration.ofHours(1)));
            lastDay = ledgerService.countCreditsSince(userId, now.minus(Duration.ofDays(1)));
        } catch (DataAccessException e) {
            log.error("Could not evaluate purchase rate for user {}, allowing purchase", userId, e);
            return Optional.empty();
        }

        if (lastHour >= maxPerHour) {
            return Optional.of(new GuardViolation(GuardViolation.RATE_LIMIT_EXCEEDED, String.format(
                "%d purchases in the last hour, maximum is %d", lastHour, maxPerHour)));
        }
        if (lastDay >= maxPerDay) {
            return Optional.of(new GuardViolation(GuardViolation.RATE_LIMIT_EXCEEDED, String.format(
                "%d purchases in the last day, maximum is %d", lastDay, maxPerDay)));
        }
        return Optional.empty();
    }
}
