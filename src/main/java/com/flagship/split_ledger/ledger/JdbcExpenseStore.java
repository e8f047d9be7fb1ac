package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.balance.TimeWindow;
import com.flagship.split_ledger.currency.CurrencyCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL expense store on plain JDBC.
 *
 * The original amount, original currency, base amount, base currency, rate,
 * approximate flag and the complete weight snapshot are stored with every
 * expense, so historical balances never depend on current weights or rates.
 */
@Repository
@Slf4j
public class JdbcExpenseStore implements ExpenseStore {

    private static final String EXPENSE_COLUMNS =
        "e.id, e.ledger_id, e.payer_id, e.original_amount, e.original_currency, e.amount_in_base, " +
        "e.base_currency, e.fx_rate, e.fx_approximate, e.category, e.description, e.occurred_at, " +
        "e.status, e.created_at";

    private final JdbcTemplate jdbcTemplate;

    public JdbcExpenseStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void lockForAppend(long ledgerId) {
        List<Long> locked = jdbcTemplate.queryForList(
            "SELECT id FROM ledgers WHERE id = ? FOR UPDATE",
            Long.class,
            ledgerId
        );
        if (locked.isEmpty()) {
            throw new IllegalArgumentException("Ledger not found: " + ledgerId);
        }
    }

    @Override
    public long appendExpense(Expense expense, String idempotencyKey) {
        if (!expense.isApproved()) {
            throw new IllegalArgumentException("Only APPROVED expenses can be appended");
        }

        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO expenses (ledger_id, payer_id, original_amount, original_currency, amount_in_base, " +
            "base_currency, fx_rate, fx_approximate, category, description, occurred_at, status, " +
            "idempotency_key, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            expense.getLedgerId(),
            expense.getPayerId(),
            expense.getOriginalAmount(),
            expense.getOriginalCurrency().getCode(),
            expense.getAmountInBase(),
            expense.getBaseCurrency().getCode(),
            expense.getFxRate(),
            expense.isFxApproximate(),
            expense.getCategory(),
            expense.getDescription(),
            Timestamp.from(expense.getOccurredAt()),
            expense.getStatus().name(),
            idempotencyKey,
            Timestamp.from(expense.getCreatedAt())
        );
        if (id == null) {
            throw new IllegalStateException("Insert did not return an expense id");
        }

        int position = 0;
        for (ParticipantShare share : expense.getWeightSnapshot().getShares()) {
            jdbcTemplate.update(
                "INSERT INTO expense_participants (expense_id, participant_id, weight, position) " +
                "VALUES (?, ?, ?, ?)",
                id,
                share.getParticipantId(),
                share.getWeight(),
                position++
            );
        }

        log.debug("Appended expense {} to ledger {} with {} participants",
            id, expense.getLedgerId(), expense.getWeightSnapshot().size());
        return id;
    }

    @Override
    public boolean markVoid(long ledgerId, long expenseId) {
        int updated = jdbcTemplate.update(
            "UPDATE expenses SET status = 'VOID', voided_at = CURRENT_TIMESTAMP " +
            "WHERE ledger_id = ? AND id = ? AND status = 'APPROVED'",
            ledgerId,
            expenseId
        );
        return updated > 0;
    }

    @Override
    public Optional<Expense> findById(long ledgerId, long expenseId) {
        return queryExpenses("e.ledger_id = ? AND e.id = ?", ledgerId, expenseId)
            .stream()
            .findFirst();
    }

    @Override
    public Optional<Expense> findByIdempotencyKey(String idempotencyKey) {
        return queryExpenses("e.idempotency_key = ?", idempotencyKey)
            .stream()
            .findFirst();
    }

    @Override
    public List<Expense> loadApprovedExpenses(long ledgerId, TimeWindow window) {
        StringBuilder where = new StringBuilder("e.ledger_id = ? AND e.status = 'APPROVED'");
        List<Object> args = new ArrayList<>();
        args.add(ledgerId);
        if (window != null && window.getFrom() != null) {
            where.append(" AND e.occurred_at >= ?");
            args.add(Timestamp.from(window.getFrom()));
        }
        if (window != null && window.getTo() != null) {
            where.append(" AND e.occurred_at < ?");
            args.add(Timestamp.from(window.getTo()));
        }
        return queryExpenses(where.toString(), args.toArray());
    }

    @Override
    public List<Expense> listExpenses(long ledgerId) {
        return queryExpenses("e.ledger_id = ?", ledgerId);
    }

    @Override
    public long countExpenses(long ledgerId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM expenses WHERE ledger_id = ?",
            Long.class,
            ledgerId
        );
        return count != null ? count : 0L;
    }

    /**
     * Loads expenses matching the condition and attaches their snapshots,
     * fetched with one query for the same condition.
     */
    private List<Expense> queryExpenses(String condition, Object... args) {
        List<ExpenseRow> rows = jdbcTemplate.query(
            "SELECT " + EXPENSE_COLUMNS + " FROM expenses e WHERE " + condition +
            " ORDER BY e.occurred_at ASC, e.id ASC",
            EXPENSE_ROW_MAPPER,
            args
        );
        if (rows.isEmpty()) {
            return List.of();
        }

        Map<Long, List<ParticipantShare>> sharesByExpense = new HashMap<>();
        jdbcTemplate.query(
            "SELECT ep.expense_id, ep.participant_id, ep.weight FROM expense_participants ep " +
            "JOIN expenses e ON e.id = ep.expense_id WHERE " + condition +
            " ORDER BY ep.expense_id, ep.position",
            (RowCallbackHandler) rs -> sharesByExpense
                .computeIfAbsent(rs.getLong("expense_id"), ignored -> new ArrayList<>())
                .add(ParticipantShare.of(rs.getLong("participant_id"), rs.getBigDecimal("weight"))),
            args
        );

        List<Expense> expenses = new ArrayList<>(rows.size());
        for (ExpenseRow row : rows) {
            List<ParticipantShare> shares = sharesByExpense.get(row.id);
            if (shares == null) {
                throw new IllegalStateException("Expense " + row.id + " has no stored weight snapshot");
            }
            expenses.add(row.toExpense(WeightSnapshot.of(shares)));
        }
        return expenses;
    }

    private static final RowMapper<ExpenseRow> EXPENSE_ROW_MAPPER = (rs, rowNum) -> new ExpenseRow(rs);

    /**
     * Expense columns read before the snapshot is attached.
     */
    private static final class ExpenseRow {
        private final long id;
        private final long ledgerId;
        private final long payerId;
        private final BigDecimal originalAmount;
        private final String originalCurrency;
        private final BigDecimal amountInBase;
        private final String baseCurrency;
        private final BigDecimal fxRate;
        private final boolean fxApproximate;
        private final String category;
        private final String description;
        private final Instant occurredAt;
        private final String status;
        private final Instant createdAt;

        private ExpenseRow(ResultSet rs) throws SQLException {
            this.id = rs.getLong("id");
            this.ledgerId = rs.getLong("ledger_id");
            this.payerId = rs.getLong("payer_id");
            this.originalAmount = rs.getBigDecimal("original_amount");
            this.originalCurrency = rs.getString("original_currency");
            this.amountInBase = rs.getBigDecimal("amount_in_base");
            this.baseCurrency = rs.getString("base_currency");
            this.fxRate = rs.getBigDecimal("fx_rate");
            this.fxApproximate = rs.getBoolean("fx_approximate");
            this.category = rs.getString("category");
            this.description = rs.getString("description");
            this.occurredAt = rs.getTimestamp("occurred_at").toInstant();
            this.status = rs.getString("status");
            this.createdAt = rs.getTimestamp("created_at").toInstant();
        }

        private Expense toExpense(WeightSnapshot snapshot) {
            return new Expense(
                id,
                ledgerId,
                payerId,
                originalAmount,
                CurrencyCode.of(originalCurrency),
                amountInBase,
                CurrencyCode.of(baseCurrency),
                fxRate,
                fxApproximate,
                category,
                description,
                occurredAt,
                snapshot,
                ExpenseStatus.valueOf(status),
                createdAt
            );
        }
    }
}
