package com.brokerage.revshare.dto;

import com.brokerage.revshare.entity.AgentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Agent's current commission split. {@code supportTier} is null for principals.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CommissionPlanDto {

    private Long agentId;
    private AgentType agentType;
    private BigDecimal gciYearToDate;
    private Integer supportTier;
    private BigDecimal commissionPercentage;
}
