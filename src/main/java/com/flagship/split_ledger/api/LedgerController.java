package com.flagship.split_ledger.api;

import com.flagship.split_ledger.api.dto.AddParticipantRequest;
import com.flagship.split_ledger.api.dto.BalancesResponse;
import com.flagship.split_ledger.api.dto.BaseCurrencyRequest;
import com.flagship.split_ledger.api.dto.CategoryTotalResponse;
import com.flagship.split_ledger.api.dto.CreateExpenseRequest;
import com.flagship.split_ledger.api.dto.ExpenseResponse;
import com.flagship.split_ledger.api.dto.LedgerResponse;
import com.flagship.split_ledger.api.dto.ParticipantResponse;
import com.flagship.split_ledger.api.dto.SetWeightRequest;
import com.flagship.split_ledger.api.dto.SettlementResponse;
import com.flagship.split_ledger.balance.TimeWindow;
import com.flagship.split_ledger.currency.CurrencyCode;
import com.flagship.split_ledger.currency.CurrencyRegistry;
import com.flagship.split_ledger.ledger.Expense;
import com.flagship.split_ledger.ledger.ExpenseDraft;
import com.flagship.split_ledger.ledger.ExpenseLedger;
import com.flagship.split_ledger.ledger.ExpenseNotFoundException;
import com.flagship.split_ledger.ledger.InvalidExpenseException;
import com.flagship.split_ledger.ledger.Ledger;
import com.flagship.split_ledger.ledger.LedgerService;
import com.flagship.split_ledger.ledger.Participant;
import com.flagship.split_ledger.ledger.ParticipantService;
import com.flagship.split_ledger.ledger.ParticipantShare;
import com.flagship.split_ledger.report.LedgerReportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP surface of the ledger.
 *
 * Requests are translated into typed drafts and service calls here; errors
 * are mapped to responses by {@link com.flagship.split_ledger.api.exception.GlobalExceptionHandler}.
 * An expense that is waiting for an exchange rate answers 202 with a
 * pending id instead of 201.
 */
@RestController
@RequestMapping("/api/ledgers")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final LedgerService ledgerService;
    private final ParticipantService participantService;
    private final ExpenseLedger expenseLedger;
    private final LedgerReportService reportService;
    private final CurrencyRegistry currencyRegistry;
    private final Clock clock;

    @PutMapping("/{ledgerId}")
    public LedgerResponse ensureLedger(@PathVariable("ledgerId") long ledgerId,
                                       @Valid @RequestBody BaseCurrencyRequest request) {
        return LedgerResponse.from(ledgerService.ensureLedger(ledgerId, currency(request.getBaseCurrency())));
    }

    @GetMapping("/{ledgerId}")
    public LedgerResponse getLedger(@PathVariable("ledgerId") long ledgerId) {
        return LedgerResponse.from(ledgerService.getLedger(ledgerId));
    }

    @PutMapping("/{ledgerId}/currency")
    public LedgerResponse setBaseCurrency(@PathVariable("ledgerId") long ledgerId,
                                          @Valid @RequestBody BaseCurrencyRequest request) {
        return LedgerResponse.from(ledgerService.setBaseCurrency(ledgerId, currency(request.getBaseCurrency())));
    }

    @PostMapping("/{ledgerId}/participants")
    public ResponseEntity<ParticipantResponse> addParticipant(@PathVariable("ledgerId") long ledgerId,
                                                              @Valid @RequestBody AddParticipantRequest request) {
        ledgerService.getLedger(ledgerId);
        Participant participant = request.getUserId() != null
            ? participantService.ensureMember(ledgerId, request.getUserId(), request.getName())
            : participantService.addVirtual(ledgerId, request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(ParticipantResponse.from(participant));
    }

    @PutMapping("/{ledgerId}/participants/{participantId}/weight")
    public ParticipantResponse setWeight(@PathVariable("ledgerId") long ledgerId,
                                         @PathVariable("participantId") long participantId,
                                         @Valid @RequestBody SetWeightRequest request) {
        return ParticipantResponse.from(participantService.setWeight(ledgerId, participantId, request.getWeight()));
    }

    @GetMapping("/{ledgerId}/participants")
    public List<ParticipantResponse> listParticipants(@PathVariable("ledgerId") long ledgerId) {
        ledgerService.getLedger(ledgerId);
        return participantService.list(ledgerId).stream().map(ParticipantResponse::from).toList();
    }

    /**
     * Records an expense. Repeating the call with the same Idempotency-Key
     * returns the expense recorded the first time.
     */
    @PostMapping("/{ledgerId}/expenses")
    public ResponseEntity<ExpenseResponse> addExpense(
            @PathVariable("ledgerId") long ledgerId,
            @Valid @RequestBody CreateExpenseRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received expense: ledgerId={}, amount={}, currency={}, participants={}, idempotencyKey={}",
            ledgerId, request.getAmount(), request.getCurrency(), request.getParticipants().size(), idempotencyKey);

        CurrencyCode currency = currencyRegistry.normalize(request.getCurrency())
            .orElseThrow(() -> new InvalidExpenseException("Unrecognized currency: " + request.getCurrency()));
        ExpenseDraft draft = ExpenseDraft.of(
            request.getPayerId(),
            request.getAmount(),
            currency,
            shares(ledgerId, request.getParticipants()),
            request.getCategory(),
            request.getDescription(),
            request.getTimestamp() != null ? request.getTimestamp() : clock.instant()
        );

        Expense expense = expenseLedger.addExpense(ledgerId, draft, idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(expense));
    }

    @PostMapping("/{ledgerId}/pending/{pendingId}/retry")
    public ResponseEntity<ExpenseResponse> retryPending(@PathVariable("ledgerId") long ledgerId,
                                                        @PathVariable("pendingId") UUID pendingId) {
        Expense expense = expenseLedger.retryPending(ledgerId, pendingId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(expense));
    }

    @DeleteMapping("/{ledgerId}/expenses/{expenseId}")
    public ExpenseResponse voidExpense(@PathVariable("ledgerId") long ledgerId,
                                       @PathVariable("expenseId") long expenseId) {
        return ExpenseResponse.from(expenseLedger.voidExpense(ledgerId, expenseId));
    }

    @GetMapping("/{ledgerId}/expenses")
    public List<ExpenseResponse> listExpenses(@PathVariable("ledgerId") long ledgerId) {
        ledgerService.getLedger(ledgerId);
        return expenseLedger.listExpenses(ledgerId).stream().map(ExpenseResponse::from).toList();
    }

    @GetMapping("/{ledgerId}/expenses/{expenseId}")
    public ExpenseResponse getExpense(@PathVariable("ledgerId") long ledgerId,
                                      @PathVariable("expenseId") long expenseId) {
        return expenseLedger.findExpense(ledgerId, expenseId)
            .map(ExpenseResponse::from)
            .orElseThrow(() -> ExpenseNotFoundException.forExpense(ledgerId, expenseId));
    }

    @GetMapping("/{ledgerId}/balances")
    public BalancesResponse balances(@PathVariable("ledgerId") long ledgerId,
                                     @RequestParam(value = "from", required = false) Instant from,
                                     @RequestParam(value = "to", required = false) Instant to,
                                     @RequestParam(value = "include_all", defaultValue = "false") boolean includeAll) {
        Ledger ledger = ledgerService.getLedger(ledgerId);
        Map<Long, BigDecimal> balances = reportService.balances(ledgerId, window(from, to), includeAll);
        return BalancesResponse.of(ledgerId, ledger.getBaseCurrency().getCode(), balances);
    }

    @GetMapping("/{ledgerId}/settlement")
    public SettlementResponse settlement(@PathVariable("ledgerId") long ledgerId,
                                         @RequestParam(value = "from", required = false) Instant from,
                                         @RequestParam(value = "to", required = false) Instant to) {
        Ledger ledger = ledgerService.getLedger(ledgerId);
        return SettlementResponse.of(ledgerId, ledger.getBaseCurrency().getCode(),
            reportService.settlement(ledgerId, window(from, to)));
    }

    @GetMapping("/{ledgerId}/categories")
    public List<CategoryTotalResponse> categoryTotals(@PathVariable("ledgerId") long ledgerId,
                                                      @RequestParam(value = "from", required = false) Instant from,
                                                      @RequestParam(value = "to", required = false) Instant to) {
        return reportService.categoryTotals(ledgerId, window(from, to)).stream()
            .map(CategoryTotalResponse::from)
            .toList();
    }

    private CurrencyCode currency(String token) {
        return currencyRegistry.normalize(token)
            .orElseThrow(() -> new IllegalArgumentException("Unrecognized currency: " + token));
    }

    /**
     * Explicit weights are taken as given; missing ones come from the
     * participant's current weight.
     */
    private List<ParticipantShare> shares(long ledgerId, List<CreateExpenseRequest.ParticipantEntry> entries) {
        List<ParticipantShare> shares = new ArrayList<>(entries.size());
        for (CreateExpenseRequest.ParticipantEntry entry : entries) {
            if (entry.getWeight() != null) {
                shares.add(ParticipantShare.of(entry.getParticipantId(), entry.getWeight()));
            } else {
                shares.addAll(participantService.sharesFor(ledgerId, List.of(entry.getParticipantId())));
            }
        }
        return shares;
    }

    private static TimeWindow window(Instant from, Instant to) {
        return from == null && to == null ? null : TimeWindow.between(from, to);
    }
}
