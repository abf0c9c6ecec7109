package com.brokerage.revshare.service;

import com.brokerage.revshare.config.RevenueShareProperties;
import com.brokerage.revshare.entity.Agent;
import com.brokerage.revshare.repository.AgentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks an agent's upline through sponsor pointers, nearest sponsor first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SponsorshipChainWalker {

    public static final int MAX_TIERS = 5;

    private final AgentRepository agentRepository;
    private final RevenueShareProperties properties;

    @Transactional(readOnly = true)
    public List<Long> walkUpline(Long agentId) {
        return walkUpline(agentId, properties.getMaxTiers());
    }

    /**
     * Sponsor ids above the given agent, excluding the agent itself. The walk stops at a
     * root, at a missing agent, at the first repeated sponsor, or after {@code maxDepth}
     * steps (never more than 5). Each sponsor appears at most once.
     */
    @Transactional(readOnly = true)
    public List<Long> walkUpline(Long agentId, int maxDepth) {
        int depth = Math.min(Math.max(maxDepth, 0), MAX_TIERS);
        List<Long> chain = new ArrayList<>(depth);

        Long currentId = agentId;
        while (chain.size() < depth) {
            Optional<Agent> current = agentRepository.findById(currentId);
            if (current.isEmpty() || current.get().getSponsorId() == null) {
                break;
            }
            Long sponsorId = current.get().getSponsorId();
            if (sponsorId.equals(agentId) || chain.contains(sponsorId)) {
                log.warn("Sponsorship cycle detected above agent {} at sponsor {}", agentId, sponsorId);
                break;
            }
            chain.add(sponsorId);
            currentId = sponsorId;
        }

        return chain;
    }
}
