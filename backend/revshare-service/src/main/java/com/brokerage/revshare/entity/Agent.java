package com.brokerage.revshare.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Agent entity - a participant in the brokerage's sponsorship hierarchy
 */
@Entity
@Table(name = "agents", indexes = {
    @Index(name = "idx_agents_sponsor_id", columnList = "sponsor_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Agent {

    public static final long MAX_AGENT_CODE = 999_999L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "agent_code", unique = true, length = 6)
    private String agentCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "agent_type", nullable = false, length = 16)
    private AgentType agentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "cap_type", length = 16)
    private CapType capType;

    /**
     * Direct upline. Null for root agents.
     */
    @Column(name = "sponsor_id")
    private Long sponsorId;

    @Column(name = "anniversary_date")
    private LocalDate anniversaryDate;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isPrincipal() {
        return agentType == AgentType.PRINCIPAL;
    }

    /**
     * Six digit, zero padded code derived from the agent id (000042)
     *
     * @throws IllegalStateException once ids no longer fit in six digits
     */
    public static String generateAgentCode(Long id) {
        if (id < 0 || id > MAX_AGENT_CODE) {
            throw new IllegalStateException("Agent code space exhausted at id " + id);
        }
        return String.format("%06d", id);
    }
}
