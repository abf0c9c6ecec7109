package com.brokerage.revshare.entity;

import jakarta.persistence.*;
import lombok.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Revenue share entity - a payout from a transaction's company GCI to one upline sponsor
 */
@Entity
@Table(name = "revenue_shares", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"transaction_id", "recipient_agent_id"})
}, indexes = {
    @Index(name = "idx_revenue_shares_pair", columnList = "recipient_agent_id, source_agent_id, created_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RevenueShare {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_id", nullable = false)
    private Long transactionId;

    @Column(name = "source_agent_id", nullable = false)
    private Long sourceAgentId;

    @Column(name = "recipient_agent_id", nullable = false)
    private Long recipientAgentId;

    /**
     * 1 = direct sponsor
     */
    @Column(nullable = false)
    private Integer tier;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
