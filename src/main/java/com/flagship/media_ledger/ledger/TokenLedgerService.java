package com.flagship.media_ledger.ledger;

import com.flagship.media_ledger.common.exception.InsufficientBalanceException;
import com.flagship.media_ledger.observability.MediaMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Token balances and the append-only ledger behind them.
 *
 * This service enforces the core invariants:
 * 1. Every balance change is written in the same transaction as exactly one ledger entry
 * 2. A balance never goes negative (conditional update plus a CHECK constraint)
 * 3. (entry type, reference id) is unique, so retries of the same debit, refund
 *    or credit are no-ops
 * 4. Ledger entries are never updated or deleted (enforced by a trigger)
 *
 * Plain JDBC is used on purpose: every mutation is a single conditional
 * statement whose row count tells us whether it took effect.
 */
@Service
@Slf4j
public class TokenLedgerService {

    private static final String ENTRY_COLUMNS =
            "id, user_id, entry_type, amount, reference_id, description, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final MediaMetrics metrics;
    private final Clock clock;

    public TokenLedgerService(JdbcTemplate jdbcTemplate, MediaMetrics metrics, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Charges {@code amount} tokens to {@code userId}.
     *
     * A second debit with the same reference returns the existing DEBIT entry
     * without charging again.
     *
     * @throws InsufficientBalanceException if the balance is lower than the amount
     */
    @Transactional
    public LedgerEntry debit(String userId, long amount, String referenceId) {
        requireUser(userId);
        requirePositive(amount);
        requireReference(referenceId);

        Optional<LedgerEntry> existing = findEntry(EntryType.DEBIT, referenceId);
        if (existing.isPresent()) {
            log.info("Debit for reference {} already recorded, returning entry {}",
                    referenceId, existing.get().getId());
            metrics.recordLedgerDuplicate(EntryType.DEBIT.name());
            return existing.get();
        }

        int updated = jdbcTemplate.update(
            "UPDATE user_balances SET balance = balance - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE user_id = ? AND balance >= ?",
            amount, userId, amount
        );
        if (updated == 0) {
            long current = getBalance(userId);
            metrics.incrementInsufficientBalance();
            log.info("Debit of {} rejected for user {}: balance {}", amount, userId, current);
            throw new InsufficientBalanceException(userId, current, amount);
        }

        // A concurrent debit with the same reference fails here on the unique
        // index and rolls back the balance update above with it.
        LedgerEntry entry = newEntry(userId, EntryType.DEBIT, amount, referenceId, "Charge for " + referenceId);
        insertEntry(entry);
        metrics.recordLedgerEntry(EntryType.DEBIT.name(), amount);
        log.info("Debited {} tokens from user {} for {}", amount, userId, referenceId);
        return entry;
    }

    /**
     * Returns tokens for a reference that was previously charged.
     *
     * @return true if the refund was applied, false if one already existed for the reference
     */
    @Transactional
    public boolean refund(String userId, long amount, String referenceId) {
        requireUser(userId);
        requirePositive(amount);
        requireReference(referenceId);

        LedgerEntry entry = newEntry(userId, EntryType.REFUND, amount, referenceId, "Refund for " + referenceId);
        if (!insertEntryIfAbsent(entry)) {
            log.info("Refund for reference {} already recorded, skipping", referenceId);
            metrics.recordLedgerDuplicate(EntryType.REFUND.name());
            return false;
        }
        addToBalance(userId, amount);
        metrics.recordLedgerEntry(EntryType.REFUND.name(), amount);
        log.info("Refunded {} tokens to user {} for {}", amount, userId, referenceId);
        return true;
    }

    /**
     * Credits tokens bought through an external payment event. The event id is
     * the CREDIT entry's reference, so duplicate deliveries credit once.
     */
    @Transactional
    public CreditResult creditFromExternalEvent(String eventId, String userId, long amount) {
        requireUser(userId);
        requirePositive(amount);
        requireReference(eventId);

        LedgerEntry entry = newEntry(userId, EntryType.CREDIT, amount, eventId, "Purchase " + eventId);
        if (!insertEntryIfAbsent(entry)) {
            log.info("Credit for event {} already applied, skipping", eventId);
            metrics.recordLedgerDuplicate(EntryType.CREDIT.name());
            return CreditResult.DUPLICATE;
        }
        addToBalance(userId, amount);
        metrics.recordLedgerEntry(EntryType.CREDIT.name(), amount);
        log.info("Credited {} tokens to user {} from event {}", amount, userId, eventId);
        return CreditResult.APPLIED;
    }

    public long getBalance(String userId) {
        List<Long> balance = jdbcTemplate.queryForList(
            "SELECT balance FROM user_balances WHERE user_id = ?",
            Long.class,
            userId
        );
        return balance.isEmpty() ? 0L : balance.get(0);
    }

    /**
     * Most recent entries first.
     */
    public List<LedgerEntry> getHistory(String userId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE user_id = ? " +
            "ORDER BY created_at DESC, id LIMIT ?",
            ledgerEntryRowMapper(),
            userId,
            limit
        );
    }

    public Optional<LedgerEntry> findEntry(EntryType entryType, String referenceId) {
        List<LedgerEntry> entries = jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM ledger_entries WHERE entry_type = ? AND reference_id = ?",
            ledgerEntryRowMapper(),
            entryType.name(),
            referenceId
        );
        return entries.stream().findFirst();
    }

    /**
     * Number of external purchase credits for a user since the given instant.
     */
    public long countCreditsSince(String userId, Instant since) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE user_id = ? AND entry_type = 'CREDIT' AND created_at >= ?",
            Long.class,
            userId,
            Timestamp.from(since)
        );
        return count != null ? count : 0L;
    }

    /**
     * Recomputes the balance from the ledger and compares it with the stored one.
     * Both are read in one transaction so the comparison sees a single snapshot.
     */
    @Transactional(readOnly = true)
    public BalanceAudit verifyBalance(String userId) {
        Long ledgerBalance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN entry_type = 'DEBIT' THEN -amount ELSE amount END), 0) " +
            "FROM ledger_entries WHERE user_id = ?",
            Long.class,
            userId
        );
        long stored = getBalance(userId);
        BalanceAudit audit = new BalanceAudit(userId, stored, ledgerBalance != null ? ledgerBalance : 0L);
        if (!audit.isConsistent()) {
            log.error("Balance mismatch for user {}: stored={}, ledger={}",
                    userId, audit.getStoredBalance(), audit.getLedgerBalance());
        }
        return audit;
    }

    private void addToBalance(String userId, long amount) {
        jdbcTemplate.update(
            "INSERT INTO user_balances (user_id, balance, created_at, updated_at) " +
            "VALUES (?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (user_id) DO UPDATE SET balance = user_balances.balance + EXCLUDED.balance, " +
            "updated_at = CURRENT_TIMESTAMP",
            userId,
            amount
        );
    }

    private void insertEntry(LedgerEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (" + ENTRY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
            entryParameters(entry)
        );
    }

    private boolean insertEntryIfAbsent(LedgerEntry entry) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO ledger_entries (" + ENTRY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (entry_type, reference_id) DO NOTHING",
            entryParameters(entry)
        );
        return inserted == 1;
    }

    private Object[] entryParameters(LedgerEntry entry) {
        return new Object[] {
            entry.getId(),
            entry.getUserId(),
            entry.getEntryType().name(),
            entry.getAmount(),
            entry.getReferenceId(),
            entry.getDescription(),
            Timestamp.from(entry.getCreatedAt())
        };
    }

    private LedgerEntry newEntry(String userId, EntryType type, long amount, String referenceId, String description) {
        return new LedgerEntry(UUID.randomUUID(), userId, type, amount, referenceId, description, clock.instant());
    }

    private void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
    }

    private void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Amount must be positive, got " + amount);
        }
    }

    private void requireReference(String referenceId) {
        if (referenceId == null || referenceId.isBlank()) {
            throw new IllegalArgumentException("Reference id is required");
        }
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            rs.getObject("id", UUID.class),
            rs.getString("user_id"),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getLong("amount"),
            rs.getString("reference_id"),
            rs.getString("description"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
