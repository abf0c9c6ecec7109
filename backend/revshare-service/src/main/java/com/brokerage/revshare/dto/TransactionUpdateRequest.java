package com.brokerage.revshare.dto;

import com.brokerage.revshare.entity.TransactionStatus;
import com.brokerage.revshare.entity.TransactionType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * The fields of a transaction that may change after entry. Null leaves a field as is.
 * The originating agent is fixed once the transaction exists.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionUpdateRequest {

    @Size(min = 1, message = "Property address cannot be blank")
    private String propertyAddress;

    @Positive(message = "Sale amount must be positive")
    private BigDecimal saleAmount;

    @DecimalMin(value = "0", inclusive = false, message = "Commission percentage must be positive")
    @DecimalMax(value = "100", message = "Commission percentage cannot exceed 100")
    private BigDecimal commissionPercentage;

    @PositiveOrZero(message = "Company GCI cannot be negative")
    private BigDecimal companyGci;

    /**
     * Together with {@link #companyPercentage}, sets company GCI to
     * {@code totalCommissionAmount * companyPercentage / 100} when no explicit GCI is given
     */
    @PositiveOrZero(message = "Total commission amount cannot be negative")
    private BigDecimal totalCommissionAmount;

    @DecimalMin(value = "0", message = "Company percentage cannot be negative")
    @DecimalMax(value = "100", message = "Company percentage cannot exceed 100")
    private BigDecimal companyPercentage;

    private LocalDate transactionDate;

    private String clientName;

    private TransactionType transactionType;

    private TransactionStatus transactionStatus;
}
