package com.flagship.split_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id and ledger MDC keys for the current request thread.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String LEDGER_ID_MDC_KEY = "ledgerId";
    public static final String EXPENSE_ID_MDC_KEY = "expenseId";

    private static final ThreadLocal<String> CORRELATION_ID = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = CORRELATION_ID.get();
        if (id == null) {
            id = generateCorrelationId();
            CORRELATION_ID.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        String value = id == null || id.isBlank() ? generateCorrelationId() : id;
        CORRELATION_ID.set(value);
        MDC.put(CORRELATION_ID_MDC_KEY, value);
    }

    /**
     * Tags subsequent log lines of this thread with the ledger id.
     */
    public static void putLedgerId(long ledgerId) {
        MDC.put(LEDGER_ID_MDC_KEY, Long.toString(ledgerId));
    }

    public static void putExpenseId(long expenseId) {
        MDC.put(EXPENSE_ID_MDC_KEY, Long.toString(expenseId));
    }

    public static void clear() {
        CORRELATION_ID.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(LEDGER_ID_MDC_KEY);
        MDC.remove(EXPENSE_ID_MDC_KEY);
    }

    /**
     * Short random id, readable in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
