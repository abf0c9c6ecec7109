package com.brokerage.revshare.controller;

import com.brokerage.revshare.dto.*;
import com.brokerage.revshare.entity.Agent;
import com.brokerage.revshare.service.AgentService;
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
 * REST API for the agent hierarchy
 */
@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
@Tag(name = "Agents", description = "Agent directory and sponsorship hierarchy APIs")
public class AgentController {

    private final AgentService agentService;
    private final TransactionService transactionService;
    private final RevenueShareService revenueShareService;

    // ==================== Directory ====================

    @GetMapping
    @Operation(summary = "List agents", description = "All agents ordered by name")
    public List<AgentDto> getAgents() {
        return agentService.getAgents();
    }

    @GetMapping("/root")
    @Operation(summary = "List root agents", description = "Agents without a sponsor")
    public List<AgentDto> getRootAgents() {
        return agentService.getRootAgents();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get agent")
    public AgentDto getAgent(@PathVariable Long id) {
        return agentService.getAgent(id);
    }

    @GetMapping("/{id}/downline")
    @Operation(summary = "Get downline", description = "Flattened downline of an agent with parent indices and earnings")
    public DownlineDto getDownline(@PathVariable Long id) {
        return agentService.getDownline(id);
    }

    @GetMapping("/{id}/commission-plan")
    @Operation(summary = "Get commission plan",
            description = "Agent's split of total commission, with the support schedule tier for support agents")
    public CommissionPlanDto getCommissionPlan(@PathVariable Long id) {
        return agentService.getCommissionPlan(id);
    }

    // ==================== Maintenance ====================

    @PostMapping
    @Operation(summary = "Add agent", description = "Register an agent, optionally under a sponsor")
    public ResponseEntity<AgentDto> createAgent(@Valid @RequestBody CreateAgentRequest request) {
        Agent agent = agentService.createAgent(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(agentService.toDto(agent));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update agent", description = "Replace name, type, cap plan, sponsor and anniversary date")
    public AgentDto updateAgent(@PathVariable Long id, @Valid @RequestBody AgentUpdateRequest request) {
        return agentService.toDto(agentService.updateAgent(id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete agent", description = "Only agents without downline, transactions or revenue shares")
    public ResponseEntity<Void> deleteAgent(@PathVariable Long id) {
        agentService.deleteAgent(id);
        return ResponseEntity.noContent().build();
    }

    // ==================== Related records ====================

    @GetMapping("/{id}/transactions")
    @Operation(summary = "Agent transactions", description = "Transactions originated by an agent, newest first")
    public List<TransactionDto> getAgentTransactions(@PathVariable Long id) {
        return transactionService.getAgentTransactions(id);
    }

    @GetMapping("/{id}/revenue-shares")
    @Operation(summary = "Agent revenue shares", description = "Revenue shares received or generated by an agent")
    public List<RevenueShareDto> getAgentRevenueShares(@PathVariable Long id) {
        return revenueShareService.getByAgent(id);
    }
}
