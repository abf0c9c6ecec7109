package com.brokerage.revshare.service;

import com.brokerage.revshare.dto.AgentDto;
import com.brokerage.revshare.dto.AgentUpdateRequest;
import com.brokerage.revshare.dto.CommissionPlanDto;
import com.brokerage.revshare.dto.CreateAgentRequest;
import com.brokerage.revshare.dto.DownlineDto;
import com.brokerage.revshare.dto.DownlineNodeDto;
import com.brokerage.revshare.entity.Agent;
import com.brokerage.revshare.entity.AgentType;
import com.brokerage.revshare.entity.CapType;
import com.brokerage.revshare.exception.ResourceNotFoundException;
import com.brokerage.revshare.repository.AgentRepository;
import com.brokerage.revshare.repository.RevenueShareRepository;
import com.brokerage.revshare.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Agent directory: registration, sponsor assignment and the downline view
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentService {

    private final AgentRepository agentRepository;
    private final TransactionRepository transactionRepository;
    private final RevenueShareRepository revenueShareRepository;
    private final CommissionCalculator commissionCalculator;
    private final Clock clock;

    // ==================== Registration ====================

    /**
     * Add an agent under an optional sponsor. Generates the agent code when none is given.
     */
    @Transactional
    public Agent createAgent(CreateAgentRequest request) {
        if (request.getSponsorId() != null && !agentRepository.existsById(request.getSponsorId())) {
            throw new IllegalArgumentException("Sponsor not found: " + request.getSponsorId());
        }
        if (request.getAgentCode() != null && agentRepository.existsByAgentCode(request.getAgentCode())) {
            throw new IllegalArgumentException("Agent code already in use: " + request.getAgentCode());
        }

        Agent agent = Agent.builder()
                .name(request.getName().trim())
                .agentCode(request.getAgentCode())
                .agentType(request.getAgentType())
                .capType(normalizeCapType(request.getAgentType(), request.getCapType()))
                .sponsorId(request.getSponsorId())
                .anniversaryDate(request.getAnniversaryDate())
                .createdAt(LocalDateTime.now(clock))
                .build();

        agent = agentRepository.save(agent);

        if (agent.getAgentCode() == null) {
            long candidate = agent.getId();
            String agentCode = Agent.generateAgentCode(candidate);
            while (agentRepository.existsByAgentCode(agentCode)) {
                agentCode = Agent.generateAgentCode(++candidate);
            }
            agent.setAgentCode(agentCode);
            agent = agentRepository.save(agent);
        }

        log.info("Registered agent {} ({}) as {} under sponsor {}",
                agent.getId(), agent.getAgentCode(), agent.getAgentType(), agent.getSponsorId());
        return agent;
    }

    // ==================== Maintenance ====================

    /**
     * Replace an agent's mutable fields. Existing revenue shares are left as they are;
     * new payouts follow the updated type, cap and sponsor.
     */
    @Transactional
    public Agent updateAgent(Long id, AgentUpdateRequest request) {
        Agent agent = agentRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.agent(id));

        Long sponsorId = request.getSponsorId();
        if (sponsorId != null) {
            if (sponsorId.equals(id)) {
                throw new IllegalStateException("An agent cannot sponsor itself");
            }
            if (!agentRepository.existsById(sponsorId)) {
                throw new IllegalArgumentException("Sponsor not found: " + sponsorId);
            }
            if (isInDownline(id, sponsorId)) {
                throw new IllegalStateException("Agent " + sponsorId + " is in the downline of agent " + id
                        + " and cannot become its sponsor");
            }
        }

        if (sponsorId == null ? agent.getSponsorId() != null : !sponsorId.equals(agent.getSponsorId())) {
            log.info("Reassigning sponsor of agent {} from {} to {}", id, agent.getSponsorId(), sponsorId);
        }

        agent.setName(request.getName().trim());
        agent.setAgentType(request.getAgentType());
        agent.setCapType(normalizeCapType(request.getAgentType(), request.getCapType()));
        agent.setSponsorId(sponsorId);
        agent.setAnniversaryDate(request.getAnniversaryDate());
        agent.setUpdatedAt(LocalDateTime.now(clock));

        return agentRepository.save(agent);
    }

    /**
     * Remove an agent with no downline, transactions or revenue shares
     */
    @Transactional
    public void deleteAgent(Long id) {
        Agent agent = agentRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.agent(id));

        if (agentRepository.existsBySponsorId(id)) {
            throw new IllegalStateException(
                    "Cannot delete agent with sponsored agents. Reassign or delete sponsored agents first.");
        }
        if (transactionRepository.existsByAgentId(id)
                || revenueShareRepository.existsByRecipientAgentIdOrSourceAgentId(id, id)) {
            throw new IllegalStateException("Cannot delete agent with transactions or revenue shares");
        }

        agentRepository.delete(agent);
        log.info("Deleted agent {} ({})", id, agent.getAgentCode());
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public List<AgentDto> getAgents() {
        return agentRepository.findAllByOrderByNameAsc().stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<AgentDto> getRootAgents() {
        return agentRepository.findBySponsorIdIsNullOrderByNameAsc().stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public AgentDto getAgent(Long id) {
        return agentRepository.findById(id)
                .map(this::toDto)
                .orElseThrow(() -> ResourceNotFoundException.agent(id));
    }

    /**
     * Breadth-first downline of an agent as a flat node list with parent indices
     */
    @Transactional(readOnly = true)
    public DownlineDto getDownline(Long id) {
        Agent root = agentRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.agent(id));

        List<DownlineNodeDto> nodes = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        Deque<Agent> queue = new ArrayDeque<>();
        Deque<Integer> indices = new ArrayDeque<>();

        nodes.add(toNode(root, -1, 0));
        visited.add(root.getId());
        queue.add(root);
        indices.add(0);

        while (!queue.isEmpty()) {
            Agent parent = queue.poll();
            int parentIndex = indices.poll();
            int depth = nodes.get(parentIndex).getDepth() + 1;

            for (Agent child : agentRepository.findBySponsorIdOrderByNameAsc(parent.getId())) {
                if (!visited.add(child.getId())) {
                    continue;
                }
                nodes.add(toNode(child, parentIndex, depth));
                queue.add(child);
                indices.add(nodes.size() - 1);
            }
        }

        AgentDto sponsor = root.getSponsorId() == null ? null
                : agentRepository.findById(root.getSponsorId()).map(this::toDto).orElse(null);

        return DownlineDto.builder()
                .rootAgentId(root.getId())
                .sponsor(sponsor)
                .nodes(nodes)
                .build();
    }

    /**
     * Agent's split of total commission. Support agents move up the schedule with the
     * company GCI of their own transactions dated this calendar year.
     */
    @Transactional(readOnly = true)
    public CommissionPlanDto getCommissionPlan(Long id) {
        Agent agent = agentRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.agent(id));

        LocalDate yearStart = LocalDate.now(clock).withDayOfYear(1);
        BigDecimal gciYtd = transactionRepository.sumCompanyGciByAgentIdSince(id, yearStart);
        if (gciYtd == null) {
            gciYtd = BigDecimal.ZERO;
        }

        CommissionPlanDto.CommissionPlanDtoBuilder plan = CommissionPlanDto.builder()
                .agentId(id)
                .agentType(agent.getAgentType())
                .gciYearToDate(gciYtd);

        if (agent.isPrincipal()) {
            return plan.commissionPercentage(commissionCalculator.principalAgentCommissionPercentage()).build();
        }
        int tier = commissionCalculator.supportAgentTier(gciYtd);
        return plan.supportTier(tier)
                .commissionPercentage(commissionCalculator.supportAgentCommissionPercentage(tier))
                .build();
    }

    public AgentDto toDto(Agent a) {
        return AgentDto.builder()
                .id(a.getId())
                .name(a.getName())
                .agentCode(a.getAgentCode())
                .agentType(a.getAgentType())
                .capType(a.getCapType())
                .sponsorId(a.getSponsorId())
                .anniversaryDate(a.getAnniversaryDate())
                .createdAt(a.getCreatedAt())
                .build();
    }

    // ==================== Internals ====================

    /**
     * Whether {@code candidateId} sits below {@code agentId}, found by walking the
     * candidate's upline until a root or an already visited agent.
     */
    private boolean isInDownline(Long agentId, Long candidateId) {
        Set<Long> visited = new HashSet<>();
        Long current = candidateId;
        while (current != null && visited.add(current)) {
            if (current.equals(agentId)) {
                return true;
            }
            current = agentRepository.findById(current).map(Agent::getSponsorId).orElse(null);
        }
        return false;
    }

    private static CapType normalizeCapType(AgentType agentType, CapType capType) {
        if (agentType == AgentType.SUPPORT) {
            return null;
        }
        return capType != null ? capType : CapType.STANDARD;
    }

    private DownlineNodeDto toNode(Agent agent, int parentIndex, int depth) {
        BigDecimal earnings = revenueShareRepository.sumAmountByRecipientAgentId(agent.getId());
        return DownlineNodeDto.builder()
                .agentId(agent.getId())
                .name(agent.getName())
                .agentType(agent.getAgentType())
                .parentIndex(parentIndex)
                .depth(depth)
                .totalEarnings(earnings != null ? earnings : BigDecimal.ZERO)
                .build();
    }
}
