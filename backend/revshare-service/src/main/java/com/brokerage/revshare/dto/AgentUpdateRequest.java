package com.brokerage.revshare.dto;

import com.brokerage.revshare.entity.AgentType;
import com.brokerage.revshare.entity.CapType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Replaces the mutable fields of an agent. A null sponsor makes the agent a root.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentUpdateRequest {

    @NotBlank(message = "Agent name is required")
    private String name;

    @NotNull(message = "Agent type is required")
    private AgentType agentType;

    private CapType capType;

    private Long sponsorId;

    private LocalDate anniversaryDate;
}
