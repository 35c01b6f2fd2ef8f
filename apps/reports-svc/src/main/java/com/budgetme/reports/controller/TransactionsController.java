package com.budgetme.reports.controller;

import com.budgetme.reports.controller.dto.TransactionRequestDto;
import com.budgetme.reports.controller.dto.TransactionResponseDto;
import com.budgetme.reports.controller.dto.TransactionsListResponseDto;
import com.budgetme.reports.model.DateRange;
import com.budgetme.reports.model.Transaction;
import com.budgetme.reports.model.TransactionKind;
import com.budgetme.reports.repository.TransactionStore;
import com.budgetme.reports.security.RequestContextHolder;
import com.budgetme.reports.security.TraceIdFilter;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/transactions")
public class TransactionsController {

    private final TransactionStore transactionStore;

    public TransactionsController(TransactionStore transactionStore) {
        this.transactionStore = transactionStore;
    }

    @GetMapping
    public ResponseEntity<TransactionsListResponseDto> listTransactions(
            @RequestHeader(TraceIdFilter.USER_HEADER) UUID userId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        DateRange range = DateRange.between(from, to);
        var transactions = transactionStore.fetchTransactions(userId, range).stream()
                .map(TransactionsController::toDto)
                .toList();
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.ok(new TransactionsListResponseDto(
                new TransactionsListResponseDto.PeriodDto(from, to),
                transactions,
                traceId));
    }

    @PostMapping
    public ResponseEntity<TransactionResponseDto> recordTransaction(
            @RequestHeader(TraceIdFilter.USER_HEADER) UUID userId,
            @Valid @RequestBody TransactionRequestDto request
    ) {
        UUID id = request.id() != null ? request.id() : UUID.randomUUID();
        transactionStore.findById(id)
                .filter(existing -> !userId.equals(existing.userId()))
                .ifPresent(existing -> {
                    throw new IllegalArgumentException("Transaction " + id + " belongs to another user");
                });
        Transaction saved = transactionStore.save(new Transaction(
                id,
                userId,
                request.amount(),
                request.date(),
                TransactionKind.parse(request.type()),
                Optional.ofNullable(request.categoryId()),
                Optional.ofNullable(request.accountId()),
                Optional.ofNullable(request.description())));
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(saved));
    }

    @DeleteMapping("/{transactionId}")
    public ResponseEntity<Void> deleteTransaction(
            @RequestHeader(TraceIdFilter.USER_HEADER) UUID userId,
            @PathVariable("transactionId") UUID transactionId
    ) {
        boolean owned = transactionStore.findById(transactionId)
                .map(existing -> userId.equals(existing.userId()))
                .orElse(false);
        if (!owned || !transactionStore.delete(transactionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> resetTransactions(@RequestHeader(TraceIdFilter.USER_HEADER) UUID userId) {
        transactionStore.deleteByUserId(userId);
        return ResponseEntity.noContent().build();
    }

    private static TransactionResponseDto toDto(Transaction transaction) {
        return new TransactionResponseDto(
                transaction.id().toString(),
                transaction.userId() != null ? transaction.userId().toString() : null,
                transaction.amount(),
                transaction.date(),
                transaction.kind().name().toLowerCase(Locale.ROOT),
                transaction.categoryId().orElse(null),
                transaction.accountId().map(UUID::toString).orElse(null),
                transaction.description().orElse(null));
    }
}
