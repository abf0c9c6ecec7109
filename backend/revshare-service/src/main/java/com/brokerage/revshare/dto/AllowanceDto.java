package com.brokerage.revshare.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Annual cap position of one sponsor/source relationship
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AllowanceDto {

    private Long recipientAgentId;
    private Long sourceAgentId;
    private BigDecimal cap;
    private BigDecimal paidThisYear;
    private BigDecimal remaining;
    private LocalDateTime yearStart;
}
