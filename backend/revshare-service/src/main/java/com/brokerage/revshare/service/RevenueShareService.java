package com.brokerage.revshare.service;

import com.brokerage.revshare.dto.AllowanceDto;
import com.brokerage.revshare.dto.RevenueShareDto;
import com.brokerage.revshare.entity.Agent;
import com.brokerage.revshare.entity.RevenueShare;
import com.brokerage.revshare.exception.ResourceNotFoundException;
import com.brokerage.revshare.repository.AgentRepository;
import com.brokerage.revshare.repository.RevenueShareRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read side of revenue shares
 */
@Service
@RequiredArgsConstructor
public class RevenueShareService {

    private final RevenueShareRepository revenueShareRepository;
    private final AgentRepository agentRepository;
    private final RevenueSharePolicy policy;
    private final AnnualPayoutLedger ledger;

    @Transactional(readOnly = true)
    public List<RevenueShareDto> getRevenueShares() {
        return toDtos(revenueShareRepository.findAllByOrderByCreatedAtDescIdDesc());
    }

    @Transactional(readOnly = true)
    public List<RevenueShareDto> getByTransaction(Long transactionId) {
        return toDtos(revenueShareRepository.findByTransactionIdOrderByTierAsc(transactionId));
    }

    /**
     * Shares the agent received or generated, newest first
     */
    @Transactional(readOnly = true)
    public List<RevenueShareDto> getByAgent(Long agentId) {
        return toDtos(revenueShareRepository.findByAgentId(agentId));
    }

    /**
     * Where a sponsor stands against its annual cap for payouts from one source agent
     */
    @Transactional(readOnly = true)
    public AllowanceDto getAllowance(Long recipientAgentId, Long sourceAgentId) {
        Agent recipient = agentRepository.findById(recipientAgentId)
                .orElseThrow(() -> ResourceNotFoundException.agent(recipientAgentId));

        LocalDateTime yearStart = ledger.startOfCurrentYear();
        BigDecimal cap = policy.capFor(recipient.getAgentType(), recipient.getCapType());
        BigDecimal paid = ledger.totalPaid(recipientAgentId, sourceAgentId, yearStart);

        return AllowanceDto.builder()
                .recipientAgentId(recipientAgentId)
                .sourceAgentId(sourceAgentId)
                .cap(cap)
                .paidThisYear(paid)
                .remaining(ledger.remainingAllowance(cap, paid))
                .yearStart(yearStart)
                .build();
    }

    public List<RevenueShareDto> toDtos(List<RevenueShare> shares) {
        return shares.stream()
                .map(s -> RevenueShareDto.builder()
                        .id(s.getId())
                        .transactionId(s.getTransactionId())
                        .sourceAgentId(s.getSourceAgentId())
                        .recipientAgentId(s.getRecipientAgentId())
                        .tier(s.getTier())
                        .amount(s.getAmount())
                        .createdAt(s.getCreatedAt())
                        .build())
                .collect(Collectors.toList());
    }
}
