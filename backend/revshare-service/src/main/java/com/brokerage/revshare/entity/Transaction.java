package com.brokerage.revshare.entity;

import jakarta.persistence.*;
import lombok.*;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Transaction entity - a closed or pending sale originated by an agent
 */
@Entity
@Table(name = "transactions", indexes = {
    @Index(name = "idx_transactions_agent_id", columnList = "agent_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Transaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agent_id", nullable = false, updatable = false)
    private Long agentId;

    @Column(name = "property_address", nullable = false)
    private String propertyAddress;

    @Column(name = "sale_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal saleAmount;

    @Column(name = "commission_percentage", nullable = false, precision = 7, scale = 4)
    private BigDecimal commissionPercentage;

    /**
     * Portion of the commission retained by the company; base for revenue share.
     */
    @Column(name = "company_gci", nullable = false, precision = 15, scale = 2)
    @Builder.Default
    private BigDecimal companyGci = BigDecimal.ZERO;

    @Column(name = "transaction_date", nullable = false)
    private LocalDate transactionDate;

    @Column(name = "client_name")
    private String clientName;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 16)
    @Builder.Default
    private TransactionType transactionType = TransactionType.BUYER;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_status", nullable = false, length = 16)
    @Builder.Default
    private TransactionStatus transactionStatus = TransactionStatus.PENDING;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
