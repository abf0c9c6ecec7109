package com.brokerage.revshare.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for an agent's downline, breadth first. Node 0 is the requested agent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DownlineDto {

    private Long rootAgentId;
    private AgentDto sponsor;
    private List<DownlineNodeDto> nodes;
}
