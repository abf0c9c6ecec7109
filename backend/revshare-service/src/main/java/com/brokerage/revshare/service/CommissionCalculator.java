package com.brokerage.revshare.service;

import com.brokerage.revshare.config.CommissionProperties;
import com.brokerage.revshare.config.CommissionProperties.SupportAgentTier;
import com.brokerage.revshare.config.RevenueShareProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Commission arithmetic for transaction entry
 */
@Component
@RequiredArgsConstructor
public class CommissionCalculator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final RevenueShareProperties revenueShareProperties;
    private final CommissionProperties commissionProperties;

    // ==================== Transaction split ====================

    public BigDecimal totalCommission(BigDecimal saleAmount, BigDecimal commissionPercentage) {
        if (saleAmount == null
                || saleAmount.compareTo(commissionProperties.getMinSaleAmount()) < 0
                || saleAmount.compareTo(commissionProperties.getMaxSaleAmount()) > 0) {
            throw new IllegalArgumentException("Sale amount must be between $"
                    + commissionProperties.getMinSaleAmount().toPlainString() + " and $"
                    + commissionProperties.getMaxSaleAmount().toPlainString());
        }
        if (commissionPercentage == null || commissionPercentage.signum() <= 0
                || commissionPercentage.compareTo(HUNDRED) > 0) {
            throw new IllegalArgumentException("Commission percentage must be between 0 and 100");
        }
        return percentOf(saleAmount, commissionPercentage);
    }

    /**
     * Company's retained share of a total commission
     */
    public BigDecimal companyGci(BigDecimal totalCommission) {
        if (totalCommission.signum() < 0) {
            throw new IllegalArgumentException("Total commission cannot be negative");
        }
        return totalCommission.multiply(revenueShareProperties.getCompanyGciRate())
                .setScale(RevenueSharePolicy.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Company GCI from a manually agreed split of the total commission
     */
    public BigDecimal companyGciFromSplit(BigDecimal totalCommission, BigDecimal companyPercentage) {
        if (totalCommission.signum() < 0) {
            throw new IllegalArgumentException("Total commission cannot be negative");
        }
        if (companyPercentage.signum() < 0 || companyPercentage.compareTo(HUNDRED) > 0) {
            throw new IllegalArgumentException("Company percentage must be between 0 and 100");
        }
        return percentOf(totalCommission, companyPercentage);
    }

    /**
     * What is left for the agent once the company GCI is taken out
     */
    public BigDecimal agentShare(BigDecimal totalCommission, BigDecimal companyGci) {
        if (totalCommission.signum() < 0 || companyGci.signum() < 0) {
            throw new IllegalArgumentException("Commission and GCI cannot be negative");
        }
        return totalCommission.subtract(companyGci).setScale(RevenueSharePolicy.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    // ==================== Support agent schedule ====================

    /**
     * 1-based band of the support schedule that contains the given GCI
     */
    public int supportAgentTier(BigDecimal totalGci) {
        if (totalGci.signum() < 0) {
            throw new IllegalArgumentException("Total GCI cannot be negative");
        }
        List<SupportAgentTier> tiers = commissionProperties.getSupportAgentTiers();
        for (int i = 0; i < tiers.size(); i++) {
            if (tiers.get(i).contains(totalGci)) {
                return i + 1;
            }
        }
        return tiers.size();
    }

    public BigDecimal supportAgentCommissionPercentage(int tier) {
        List<SupportAgentTier> tiers = commissionProperties.getSupportAgentTiers();
        if (tier < 1 || tier > tiers.size()) {
            throw new IllegalArgumentException("Invalid tier level: " + tier);
        }
        return tiers.get(tier - 1).getPercentage();
    }

    public BigDecimal principalAgentCommissionPercentage() {
        return commissionProperties.getPrincipalAgentPercentage();
    }

    private static BigDecimal percentOf(BigDecimal amount, BigDecimal percentage) {
        return amount.multiply(percentage).divide(HUNDRED, RevenueSharePolicy.MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
