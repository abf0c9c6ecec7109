package com.brokerage.revshare.controller;

import com.brokerage.revshare.dto.CreateTransactionRequest;
import com.brokerage.revshare.dto.RevenueShareDto;
import com.brokerage.revshare.dto.TransactionDto;
import com.brokerage.revshare.dto.TransactionUpdateRequest;
import com.brokerage.revshare.entity.Transaction;
import com.brokerage.revshare.exception.ResourceNotFoundException;
import com.brokerage.revshare.service.RevenueShareService;
import com.brokerage.revshare.service.TransactionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for transactions and their revenue shares
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Tag(name = "Transactions", description = "Transaction entry and revenue share fan-out APIs")
public class TransactionController {

    private final TransactionService transactionService;
    private final RevenueShareService revenueShareService;

    @GetMapping
    @Operation(summary = "List transactions", description = "All transactions, newest transaction date first")
    public List<TransactionDto> getTransactions() {
        return transactionService.getTransactions();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get transaction")
    public TransactionDto getTransaction(@PathVariable Long id) {
        return transactionService.getTransaction(id);
    }

    @PostMapping
    @Operation(summary = "Enter transaction", description = "Persist a transaction and pay revenue share to the agent's upline")
    public ResponseEntity<TransactionDto> createTransaction(@Valid @RequestBody CreateTransactionRequest request) {
        Transaction transaction = transactionService.createTransaction(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(transactionService.toDto(transaction));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update transaction", description = "Revenue shares are regenerated when company GCI changes")
    public TransactionDto updateTransaction(@PathVariable Long id,
                                            @Valid @RequestBody TransactionUpdateRequest request) {
        return transactionService.updateTransaction(id, request)
                .map(transactionService::toDto)
                .orElseThrow(() -> ResourceNotFoundException.transaction(id));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete transaction", description = "Deletes the transaction and its revenue shares")
    public ResponseEntity<Void> deleteTransaction(@PathVariable Long id) {
        if (!transactionService.deleteTransaction(id)) {
            throw ResourceNotFoundException.transaction(id);
        }
        return ResponseEntity.noContent().build();
    }

    // ==================== Revenue Shares ====================

    @GetMapping("/{id}/revenue-shares")
    @Operation(summary = "Transaction revenue shares", description = "Revenue shares of a transaction ordered by tier")
    public List<RevenueShareDto> getRevenueShares(@PathVariable Long id) {
        return revenueShareService.getByTransaction(id);
    }

    @PostMapping("/{id}/revenue-shares/recalculate")
    @Operation(summary = "Recalculate revenue shares (admin)",
            description = "Drop and regenerate a transaction's revenue shares from the current hierarchy")
    public List<RevenueShareDto> recalculateRevenueShares(@PathVariable Long id) {
        return revenueShareService.toDtos(transactionService.recalculateRevenueShares(id));
    }
}
