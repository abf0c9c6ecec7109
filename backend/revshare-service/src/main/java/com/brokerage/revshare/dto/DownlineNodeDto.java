package com.brokerage.revshare.dto;

import com.brokerage.revshare.entity.AgentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One agent in a flattened downline. {@code parentIndex} points into the enclosing
 * node list; -1 for the root of the listing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DownlineNodeDto {

    private Long agentId;
    private String name;
    private AgentType agentType;
    private int parentIndex;
    private int depth;
    private BigDecimal totalEarnings;
}
