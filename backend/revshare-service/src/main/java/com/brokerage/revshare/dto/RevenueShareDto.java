package com.brokerage.revshare.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * DTO for a single revenue share payout
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RevenueShareDto {

    private Long id;
    private Long transactionId;
    private Long sourceAgentId;
    private Long recipientAgentId;
    private int tier;
    private BigDecimal amount;
    private LocalDateTime createdAt;
}
