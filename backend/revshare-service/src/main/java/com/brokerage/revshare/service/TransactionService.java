package com.brokerage.revshare.service;

import com.brokerage.revshare.dto.CreateTransactionRequest;
import com.brokerage.revshare.dto.TransactionDto;
import com.brokerage.revshare.dto.TransactionUpdateRequest;
import com.brokerage.revshare.entity.RevenueShare;
import com.brokerage.revshare.entity.Transaction;
import com.brokerage.revshare.entity.TransactionStatus;
import com.brokerage.revshare.entity.TransactionType;
import com.brokerage.revshare.event.TransactionEvent;
import com.brokerage.revshare.event.TransactionEventType;
import com.brokerage.revshare.exception.ResourceNotFoundException;
import com.brokerage.revshare.repository.AgentRepository;
import com.brokerage.revshare.repository.RevenueShareRepository;
import com.brokerage.revshare.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Transaction entry and maintenance. Keeps each transaction's revenue shares in step
 * with its current company GCI.
 *
 * Every write runs as one database transaction: a storage failure while fanning out
 * revenue shares rolls back the transaction write with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private final TransactionRepository transactionRepository;
    private final RevenueShareRepository revenueShareRepository;
    private final AgentRepository agentRepository;
    private final RevenueShareEngine revenueShareEngine;
    private final CommissionCalculator commissionCalculator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // ==================== Lifecycle ====================

    /**
     * Persist a transaction and generate its revenue shares
     */
    @Transactional
    public Transaction createTransaction(CreateTransactionRequest request) {
        if (!agentRepository.existsById(request.getAgentId())) {
            throw new IllegalArgumentException("Agent not found: " + request.getAgentId());
        }

        BigDecimal totalCommission = commissionCalculator.totalCommission(
                request.getSaleAmount(), request.getCommissionPercentage());
        BigDecimal companyGci = request.getCompanyGci() != null
                ? toMoney(request.getCompanyGci())
                : commissionCalculator.companyGci(totalCommission);

        Transaction transaction = Transaction.builder()
                .agentId(request.getAgentId())
                .propertyAddress(request.getPropertyAddress())
                .saleAmount(toMoney(request.getSaleAmount()))
                .commissionPercentage(request.getCommissionPercentage())
                .companyGci(companyGci)
                .transactionDate(request.getTransactionDate())
                .clientName(request.getClientName())
                .transactionType(request.getTransactionType() != null
                        ? request.getTransactionType() : TransactionType.BUYER)
                .transactionStatus(request.getTransactionStatus() != null
                        ? request.getTransactionStatus() : TransactionStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();

        transaction = transactionRepository.save(transaction);
        log.info("Created transaction {} for agent {} with company GCI {}",
                transaction.getId(), transaction.getAgentId(), companyGci);

        List<RevenueShare> shares = revenueShareEngine.processRevenueShare(transaction);
        publish(TransactionEventType.CREATED, transaction, true, shares.size());

        return transaction;
    }

    /**
     * Apply an update. Revenue shares are regenerated only when the company GCI changes,
     * either set directly or derived from a total commission and company percentage split.
     *
     * @return the updated transaction, or empty if it does not exist
     */
    @Transactional
    public Optional<Transaction> updateTransaction(Long id, TransactionUpdateRequest update) {
        Optional<Transaction> existing = transactionRepository.findLockedById(id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }

        Transaction transaction = existing.get();
        BigDecimal oldCompanyGci = transaction.getCompanyGci();

        applyUpdate(transaction, update);
        commissionCalculator.totalCommission(transaction.getSaleAmount(), transaction.getCommissionPercentage());
        transaction.setUpdatedAt(LocalDateTime.now(clock));
        transaction = transactionRepository.save(transaction);

        boolean gciChanged = oldCompanyGci.compareTo(transaction.getCompanyGci()) != 0;
        int shareCount = 0;
        if (gciChanged) {
            log.info("Company GCI of transaction {} changed from {} to {}, regenerating revenue shares",
                    id, oldCompanyGci, transaction.getCompanyGci());
            shareCount = revenueShareEngine.regenerate(transaction).size();
        }

        publish(TransactionEventType.UPDATED, transaction, gciChanged, shareCount);
        return Optional.of(transaction);
    }

    /**
     * Delete a transaction together with its revenue shares
     *
     * @return false if the transaction does not exist
     */
    @Transactional
    public boolean deleteTransaction(Long id) {
        Optional<Transaction> existing = transactionRepository.findLockedById(id);
        if (existing.isEmpty()) {
            return false;
        }

        Transaction transaction = existing.get();
        int removed = revenueShareRepository.deleteByTransactionId(id);
        transactionRepository.delete(transaction);
        log.info("Deleted transaction {} and {} revenue share(s)", id, removed);

        publish(TransactionEventType.DELETED, transaction, false, 0);
        return true;
    }

    /**
     * Rebuild a transaction's revenue shares from the current hierarchy and caps
     */
    @Transactional
    public List<RevenueShare> recalculateRevenueShares(Long id) {
        Transaction transaction = transactionRepository.findLockedById(id)
                .orElseThrow(() -> ResourceNotFoundException.transaction(id));

        List<RevenueShare> shares = revenueShareEngine.regenerate(transaction);
        publish(TransactionEventType.UPDATED, transaction, true, shares.size());
        return shares;
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public List<TransactionDto> getTransactions() {
        return transactionRepository.findAllByOrderByTransactionDateDescIdDesc().stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public TransactionDto getTransaction(Long id) {
        return transactionRepository.findById(id)
                .map(this::toDto)
                .orElseThrow(() -> ResourceNotFoundException.transaction(id));
    }

    @Transactional(readOnly = true)
    public List<TransactionDto> getAgentTransactions(Long agentId) {
        return transactionRepository.findByAgentIdOrderByTransactionDateDescIdDesc(agentId).stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    public TransactionDto toDto(Transaction t) {
        BigDecimal totalCommission = commissionCalculator.totalCommission(t.getSaleAmount(), t.getCommissionPercentage());
        return TransactionDto.builder()
                .id(t.getId())
                .agentId(t.getAgentId())
                .propertyAddress(t.getPropertyAddress())
                .saleAmount(t.getSaleAmount())
                .commissionPercentage(t.getCommissionPercentage())
                .totalCommission(totalCommission)
                .companyGci(t.getCompanyGci())
                .agentShare(commissionCalculator.agentShare(totalCommission, t.getCompanyGci()))
                .transactionDate(t.getTransactionDate())
                .clientName(t.getClientName())
                .transactionType(t.getTransactionType())
                .transactionStatus(t.getTransactionStatus())
                .createdAt(t.getCreatedAt())
                .build();
    }

    // ==================== Internals ====================

    private void applyUpdate(Transaction transaction, TransactionUpdateRequest update) {
        if (update.getPropertyAddress() != null) {
            transaction.setPropertyAddress(update.getPropertyAddress());
        }
        if (update.getSaleAmount() != null) {
            transaction.setSaleAmount(toMoney(update.getSaleAmount()));
        }
        if (update.getCommissionPercentage() != null) {
            transaction.setCommissionPercentage(update.getCommissionPercentage());
        }
        if (update.getCompanyGci() != null) {
            transaction.setCompanyGci(toMoney(update.getCompanyGci()));
        } else if (update.getTotalCommissionAmount() != null && update.getCompanyPercentage() != null) {
            transaction.setCompanyGci(commissionCalculator.companyGciFromSplit(
                    update.getTotalCommissionAmount(), update.getCompanyPercentage()));
        }
        if (update.getTransactionDate() != null) {
            transaction.setTransactionDate(update.getTransactionDate());
        }
        if (update.getClientName() != null) {
            transaction.setClientName(update.getClientName());
        }
        if (update.getTransactionType() != null) {
            transaction.setTransactionType(update.getTransactionType());
        }
        if (update.getTransactionStatus() != null) {
            transaction.setTransactionStatus(update.getTransactionStatus());
        }
    }

    private void publish(TransactionEventType type, Transaction transaction, boolean recalculated, int shareCount) {
        eventPublisher.publishEvent(TransactionEvent.builder()
                .type(type)
                .transactionId(transaction.getId())
                .agentId(transaction.getAgentId())
                .companyGci(transaction.getCompanyGci())
                .revenueSharesRecalculated(recalculated)
                .revenueShareCount(shareCount)
                .build());
    }

    private static BigDecimal toMoney(BigDecimal value) {
        return value.setScale(RevenueSharePolicy.MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
