package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.category.CategoryNormalizer;
import com.flagship.split_ledger.fx.ExchangeRate;
import com.flagship.split_ledger.fx.RateResolver;
import com.flagship.split_ledger.fx.RateUnavailableException;
import com.flagship.split_ledger.ledger.event.ExpenseRecordedEvent;
import com.flagship.split_ledger.ledger.event.ExpenseVoidedEvent;
import com.flagship.split_ledger.observability.CorrelationContext;
import com.flagship.split_ledger.observability.LedgerMetrics;
import com.flagship.split_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records expenses and voids them.
 *
 * Recording converts the draft into the ledger's base currency at a rate
 * fixed once, freezes the participants' weights, and writes an
 * ExpenseRecorded event to the outbox in the same transaction. When no rate
 * can be resolved the draft is parked instead and the caller gets an
 * {@link AwaitingRateException} with the id to retry under.
 *
 * Mutations of one ledger are serialized by a row lock on the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseLedger {

    static final String AGGREGATE_TYPE = "Ledger";

    private final LedgerService ledgerService;
    private final ParticipantService participantService;
    private final ExpenseStore expenseStore;
    private final RateResolver rateResolver;
    private final CategoryNormalizer categoryNormalizer;
    private final PendingExpenseRegistry pendingExpenses;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Records an expense.
     *
     * @param idempotencyKey optional; a repeated key returns the expense created
     *                       the first time instead of recording a new one
     * @throws InvalidExpenseException  if the draft is missing or names someone
     *                                  who is not a member of the ledger
     * @throws AwaitingRateException    if no exchange rate is available; nothing is recorded
     * @throws IllegalArgumentException if the ledger does not exist
     * @throws IllegalStateException    if the key was already used in another ledger
     */
    @Transactional
    public Expense addExpense(long ledgerId, ExpenseDraft draft, String idempotencyKey) {
        if (draft == null) {
            throw new InvalidExpenseException("Expense draft is required");
        }
        return record(ledgerId, draft, normalizeKey(idempotencyKey), null);
    }

    @Transactional
    public Expense addExpense(long ledgerId, ExpenseDraft draft) {
        return addExpense(ledgerId, draft, null);
    }

    /**
     * Re-submits a draft parked for lack of an exchange rate. On success the
     * parked draft is dropped; on another rate failure it stays parked under
     * the same id.
     *
     * @throws ExpenseNotFoundException if no such draft is parked for the ledger
     */
    @Transactional
    public Expense retryPending(long ledgerId, UUID pendingId) {
        PendingExpenseRegistry.PendingExpense parked = pendingExpenses.find(ledgerId, pendingId)
            .orElseThrow(() -> ExpenseNotFoundException.forPendingDraft(ledgerId, pendingId));
        Expense expense = record(ledgerId, parked.getDraft(), parked.getIdempotencyKey(), pendingId);
        pendingExpenses.remove(pendingId);
        return expense;
    }

    /**
     * Marks an expense VOID. Voiding an already void expense changes nothing.
     *
     * @throws ExpenseNotFoundException if the expense is not in the ledger
     */
    @Transactional
    public Expense voidExpense(long ledgerId, long expenseId) {
        CorrelationContext.putLedgerId(ledgerId);
        CorrelationContext.putExpenseId(expenseId);

        expenseStore.lockForAppend(ledgerId);
        Expense expense = expenseStore.findById(ledgerId, expenseId)
            .orElseThrow(() -> ExpenseNotFoundException.forExpense(ledgerId, expenseId));
        if (!expense.isApproved()) {
            log.info("Expense already void");
            return expense;
        }

        expenseStore.markVoid(ledgerId, expenseId);
        Expense voided = expense.markVoid();
        outboxService.append(AGGREGATE_TYPE, ledgerId, ExpenseVoidedEvent.EVENT_TYPE,
            ExpenseVoidedEvent.fromExpense(voided, clock.instant()));
        metrics.incrementExpensesVoided();
        log.info("Expense voided: amountInBase={} {}", voided.getAmountInBase(), voided.getBaseCurrency());
        return voided;
    }

    @Transactional(readOnly = true)
    public Optional<Expense> findExpense(long ledgerId, long expenseId) {
        return expenseStore.findById(ledgerId, expenseId);
    }

    @Transactional(readOnly = true)
    public List<Expense> listExpenses(long ledgerId) {
        return expenseStore.listExpenses(ledgerId);
    }

    private Expense record(long ledgerId, ExpenseDraft draft, String idempotencyKey, UUID retriedPendingId) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.putLedgerId(ledgerId);

        if (idempotencyKey != null) {
            Optional<Expense> previous = idempotencyService.findPrevious(idempotencyKey);
            if (previous.isPresent()) {
                return replay(ledgerId, idempotencyKey, previous.get());
            }
            metrics.recordIdempotencyMiss();
        }

        Ledger ledger = ledgerService.getLedger(ledgerId);
        participantService.requireMembers(ledgerId, draft.involvedParticipantIds());
        ExchangeRate rate;
        try {
            rate = rateResolver.resolve(draft.getCurrency(), ledger.getBaseCurrency(), draft.getAsOf());
        } catch (RateUnavailableException e) {
            metrics.recordExpenseRecorded(draft.getCurrency().getCode(), "awaiting_rate");
            UUID pendingId = retriedPendingId != null
                ? retriedPendingId
                : pendingExpenses.park(ledgerId, draft, idempotencyKey, e.getFrom(), e.getTo());
            throw new AwaitingRateException(pendingId, e.getFrom(), e.getTo());
        }

        expenseStore.lockForAppend(ledgerId);
        // Base currency may only change while the ledger is empty; re-read under the lock
        Ledger locked = ledgerService.getLedger(ledgerId);
        if (!locked.getBaseCurrency().equals(ledger.getBaseCurrency())) {
            throw new IllegalStateException(String.format(
                "Base currency of ledger %d changed from %s to %s while recording an expense",
                ledgerId, ledger.getBaseCurrency(), locked.getBaseCurrency()));
        }

        Expense expense = Expense.create(ledgerId, draft, ledger.getBaseCurrency(), rate,
            categoryNormalizer.normalize(draft.getCategory()), clock.instant());
        long expenseId = expenseStore.appendExpense(expense, idempotencyKey);
        Expense saved = expense.withId(expenseId);
        CorrelationContext.putExpenseId(expenseId);

        outboxService.append(AGGREGATE_TYPE, ledgerId, ExpenseRecordedEvent.EVENT_TYPE,
            ExpenseRecordedEvent.fromExpense(saved, clock.instant()));
        if (idempotencyKey != null) {
            idempotencyService.remember(idempotencyKey, saved);
        }

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordExpenseRecorded(saved.getOriginalCurrency().getCode(),
            saved.isFxApproximate() ? "approximate" : "exact");
        metrics.recordLatency("add_expense", duration);
        log.info("Expense recorded: {} {} -> {} {} (rate={}, layer={}, approximate={}), participants={}, duration={}ms",
            saved.getOriginalAmount(), saved.getOriginalCurrency(),
            saved.getAmountInBase(), saved.getBaseCurrency(),
            rate.getRate(), rate.getLayer(), rate.isApproximate(),
            saved.getWeightSnapshot().size(), duration);
        return saved;
    }

    private Expense replay(long ledgerId, String idempotencyKey, Expense previous) {
        if (previous.getLedgerId() != ledgerId) {
            throw new IllegalStateException(String.format(
                "Idempotency key %s was already used in another ledger", idempotencyKey));
        }
        metrics.recordIdempotencyHit();
        log.info("Idempotent replay: returning expense {}", previous.getId());
        return previous;
    }

    private static String normalizeKey(String idempotencyKey) {
        return idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey.strip();
    }
}
