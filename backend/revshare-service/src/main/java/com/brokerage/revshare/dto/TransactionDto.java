package com.brokerage.revshare.dto;

import com.brokerage.revshare.entity.TransactionStatus;
import com.brokerage.revshare.entity.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionDto {

    private Long id;
    private Long agentId;
    private String propertyAddress;
    private BigDecimal saleAmount;
    private BigDecimal commissionPercentage;
    private BigDecimal totalCommission;
    private BigDecimal companyGci;
    private BigDecimal agentShare;
    private LocalDate transactionDate;
    private String clientName;
    private TransactionType transactionType;
    private TransactionStatus transactionStatus;
    private LocalDateTime createdAt;
}
