package com.brokerage.revshare.service;

import com.brokerage.revshare.entity.Agent;
import com.brokerage.revshare.entity.RevenueShare;
import com.brokerage.revshare.entity.Transaction;
import com.brokerage.revshare.repository.AgentRepository;
import com.brokerage.revshare.repository.RevenueShareRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fans a transaction's company GCI out to the originating agent's upline, one capped
 * payout per sponsor.
 *
 * Missing agents are skipped rather than treated as errors. Storage failures propagate
 * to the caller so the surrounding transaction rolls back as a whole.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RevenueShareEngine {

    private final AgentRepository agentRepository;
    private final RevenueShareRepository revenueShareRepository;
    private final SponsorshipChainWalker chainWalker;
    private final RevenueSharePolicy policy;
    private final AnnualPayoutLedger ledger;
    private final Clock clock;

    /**
     * Compute and persist revenue shares for a transaction. Expects the transaction's
     * previous shares to be gone already; see {@link #regenerate(Transaction)}.
     *
     * @return the persisted shares, nearest tier first
     */
    @Transactional
    public List<RevenueShare> processRevenueShare(Transaction transaction) {
        Long sourceAgentId = transaction.getAgentId();

        Optional<Agent> sourceAgent = agentRepository.findById(sourceAgentId);
        if (sourceAgent.isEmpty()) {
            log.warn("Transaction {} references missing agent {}, no revenue share generated",
                    transaction.getId(), sourceAgentId);
            return List.of();
        }

        BigDecimal companyGci = transaction.getCompanyGci();
        if (companyGci == null || companyGci.signum() <= 0) {
            log.debug("Transaction {} has non-positive company GCI {}, nothing to share",
                    transaction.getId(), companyGci);
            return List.of();
        }

        List<Long> chain = chainWalker.walkUpline(sourceAgentId);
        if (chain.isEmpty()) {
            return List.of();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime yearStart = ledger.startOfCurrentYear();
        List<RevenueShare> created = new ArrayList<>();

        for (int i = 0; i < chain.size(); i++) {
            int tier = i + 1;
            Long sponsorId = chain.get(i);

            Optional<Agent> sponsorOpt = agentRepository.findById(sponsorId);
            if (sponsorOpt.isEmpty()) {
                log.warn("Sponsor {} at tier {} for transaction {} no longer exists, skipping",
                        sponsorId, tier, transaction.getId());
                continue;
            }
            Agent sponsor = sponsorOpt.get();

            BigDecimal rawAmount = policy.rawAmount(companyGci, sponsor.getAgentType());
            BigDecimal cap = policy.capFor(sponsor.getAgentType(), sponsor.getCapType());
            BigDecimal alreadyPaid = ledger.totalPaid(sponsorId, sourceAgentId, yearStart);
            BigDecimal remaining = ledger.remainingAllowance(cap, alreadyPaid);
            BigDecimal finalAmount = rawAmount.min(remaining);

            log.debug("Tier {} sponsor {}: raw={} cap={} paid={} final={}",
                    tier, sponsorId, rawAmount, cap, alreadyPaid, finalAmount);

            if (finalAmount.signum() <= 0) {
                continue;
            }

            RevenueShare share = RevenueShare.builder()
                    .transactionId(transaction.getId())
                    .sourceAgentId(sourceAgentId)
                    .recipientAgentId(sponsorId)
                    .tier(tier)
                    .amount(finalAmount)
                    .createdAt(now)
                    .build();
            created.add(revenueShareRepository.save(share));
        }

        log.info("Generated {} revenue share(s) for transaction {} from agent {}",
                created.size(), transaction.getId(), sourceAgentId);
        return created;
    }

    /**
     * Drop a transaction's existing shares and compute them again from its current GCI
     */
    @Transactional
    public List<RevenueShare> regenerate(Transaction transaction) {
        int removed = revenueShareRepository.deleteByTransactionId(transaction.getId());
        log.debug("Removed {} stale revenue share(s) for transaction {}", removed, transaction.getId());
        return processRevenueShare(transaction);
    }
}
