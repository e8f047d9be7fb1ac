package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.currency.CurrencyCode;
import com.flagship.split_ledger.currency.CurrencyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;

/**
 * Creates ledgers and manages their base currency.
 *
 * The base currency is fixed once the ledger holds an expense: stored base
 * amounts would otherwise mix currencies.
 */
@Service
@Slf4j
public class LedgerService {

    private static final RowMapper<Ledger> LEDGER_ROW_MAPPER = (rs, rowNum) -> new Ledger(
        rs.getLong("id"),
        CurrencyCode.of(rs.getString("base_currency")),
        rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;
    private final CurrencyRegistry currencyRegistry;
    private final Clock clock;

    public LedgerService(JdbcTemplate jdbcTemplate, CurrencyRegistry currencyRegistry, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.currencyRegistry = currencyRegistry;
        this.clock = clock;
    }

    /**
     * Creates the ledger if it does not exist yet. An existing ledger keeps its
     * base currency.
     */
    @Transactional
    public Ledger ensureLedger(long ledgerId, CurrencyCode defaultCurrency) {
        requireSupported(defaultCurrency);
        int inserted = jdbcTemplate.update(
            "INSERT INTO ledgers (id, base_currency, created_at) VALUES (?, ?, ?) ON CONFLICT (id) DO NOTHING",
            ledgerId,
            defaultCurrency.getCode(),
            Timestamp.from(clock.instant())
        );
        if (inserted > 0) {
            log.info("Created ledger {} with base currency {}", ledgerId, defaultCurrency);
        }
        return getLedger(ledgerId);
    }

    /**
     * @throws IllegalArgumentException if the ledger does not exist
     */
    @Transactional(readOnly = true)
    public Ledger getLedger(long ledgerId) {
        List<Ledger> ledgers = jdbcTemplate.query(
            "SELECT id, base_currency, created_at FROM ledgers WHERE id = ?",
            LEDGER_ROW_MAPPER,
            ledgerId
        );
        if (ledgers.isEmpty()) {
            throw new IllegalArgumentException("Ledger not found: " + ledgerId);
        }
        return ledgers.get(0);
    }

    /**
     * Changes the base currency of a ledger that holds no expenses.
     *
     * @throws IllegalStateException if the ledger already holds expenses
     */
    @Transactional
    public Ledger setBaseCurrency(long ledgerId, CurrencyCode currency) {
        requireSupported(currency);
        List<Ledger> locked = jdbcTemplate.query(
            "SELECT id, base_currency, created_at FROM ledgers WHERE id = ? FOR UPDATE",
            LEDGER_ROW_MAPPER,
            ledgerId
        );
        if (locked.isEmpty()) {
            throw new IllegalArgumentException("Ledger not found: " + ledgerId);
        }
        Ledger current = locked.get(0);
        if (current.getBaseCurrency().equals(currency)) {
            return current;
        }

        Long expenses = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM expenses WHERE ledger_id = ?",
            Long.class,
            ledgerId
        );
        if (expenses != null && expenses > 0) {
            throw new IllegalStateException(String.format(
                "Cannot change base currency of ledger %d from %s to %s: it already holds %d expenses",
                ledgerId, current.getBaseCurrency(), currency, expenses));
        }

        jdbcTemplate.update("UPDATE ledgers SET base_currency = ? WHERE id = ?", currency.getCode(), ledgerId);
        log.info("Ledger {} base currency changed: {} -> {}", ledgerId, current.getBaseCurrency(), currency);
        return new Ledger(ledgerId, currency, current.getCreatedAt());
    }

    private void requireSupported(CurrencyCode currency) {
        if (currency == null || !currencyRegistry.isSupported(currency)) {
            throw new IllegalArgumentException("Unsupported base currency: " + currency);
        }
    }
}
