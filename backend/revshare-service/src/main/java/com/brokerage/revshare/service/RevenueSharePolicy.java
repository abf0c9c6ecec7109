package com.brokerage.revshare.service;

import com.brokerage.revshare.config.RevenueShareProperties;
import com.brokerage.revshare.entity.AgentType;
import com.brokerage.revshare.entity.CapType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Payout rate and annual cap per sponsor. The rate depends on the sponsor's agent type
 * only, never on the tier the sponsor sits at.
 */
@Component
@RequiredArgsConstructor
public class RevenueSharePolicy {

    public static final int MONEY_SCALE = 2;

    private final RevenueShareProperties properties;

    public BigDecimal rateFor(AgentType sponsorType) {
        return switch (sponsorType) {
            case PRINCIPAL -> properties.getPrincipalRate();
            case SUPPORT -> properties.getSupportRate();
        };
    }

    /**
     * Annual ceiling for one sponsor/source relationship. A principal without a cap plan
     * is treated as standard.
     */
    public BigDecimal capFor(AgentType sponsorType, CapType capType) {
        if (sponsorType == AgentType.SUPPORT) {
            return properties.getSupportCap();
        }
        return capType == CapType.TEAM ? properties.getTeamCap() : properties.getStandardCap();
    }

    /**
     * Uncapped payout for a sponsor. Zero for a missing, zero or negative GCI.
     */
    public BigDecimal rawAmount(BigDecimal companyGci, AgentType sponsorType) {
        if (companyGci == null || companyGci.signum() <= 0) {
            return BigDecimal.ZERO.setScale(MONEY_SCALE);
        }
        return companyGci.multiply(rateFor(sponsorType)).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
