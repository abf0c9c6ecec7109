package com.brokerage.revshare.dto;

import com.brokerage.revshare.entity.TransactionStatus;
import com.brokerage.revshare.entity.TransactionType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request DTO for entering a transaction. Company GCI defaults to the configured
 * share of total commission when omitted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateTransactionRequest {

    @NotNull(message = "Agent is required")
    private Long agentId;

    @NotBlank(message = "Property address is required")
    private String propertyAddress;

    @NotNull(message = "Sale amount is required")
    @Positive(message = "Sale amount must be positive")
    private BigDecimal saleAmount;

    @NotNull(message = "Commission percentage is required")
    @DecimalMin(value = "0", inclusive = false, message = "Commission percentage must be positive")
    @DecimalMax(value = "100", message = "Commission percentage cannot exceed 100")
    private BigDecimal commissionPercentage;

    @PositiveOrZero(message = "Company GCI cannot be negative")
    private BigDecimal companyGci;

    @NotNull(message = "Transaction date is required")
    private LocalDate transactionDate;

    private String clientName;

    private TransactionType transactionType;

    private TransactionStatus transactionStatus;
}
