package com.brokerage.revshare.dto;

import com.brokerage.revshare.entity.AgentType;
import com.brokerage.revshare.entity.CapType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Request DTO for adding an agent to the hierarchy
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateAgentRequest {

    @NotBlank(message = "Agent name is required")
    private String name;

    @Pattern(regexp = "^\\d{6}$", message = "Agent code must be 6 digits")
    private String agentCode;

    @NotNull(message = "Agent type is required")
    private AgentType agentType;

    private CapType capType;

    private Long sponsorId;

    private LocalDate anniversaryDate;
}
