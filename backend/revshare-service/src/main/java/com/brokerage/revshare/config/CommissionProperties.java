package com.brokerage.revshare.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Commission plan: accepted sale range, the principal split and the support agent
 * schedule keyed by company GCI earned this year.
 *
 * YAML Configuration:
 * <pre>
 * brokerage:
 *   commission:
 *     min-sale-amount: 10000
 *     max-sale-amount: 1000000000
 *     principal-agent-percentage: 80
 *     support-agent-tiers:
 *       - min-gci: 0
 *         max-gci: 40000
 *         percentage: 50
 *       - min-gci: 40000
 *         percentage: 60
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "brokerage.commission")
public class CommissionProperties {

    private BigDecimal minSaleAmount = new BigDecimal("10000");

    private BigDecimal maxSaleAmount = new BigDecimal("1000000000");

    /**
     * Agent's cut of total commission for principals
     */
    private BigDecimal principalAgentPercentage = new BigDecimal("80");

    /**
     * Ascending GCI bands. The last band has no upper bound.
     */
    private List<SupportAgentTier> supportAgentTiers = new ArrayList<>(List.of(
            tier("0", "40000", "50"),
            tier("40000", "80000", "60"),
            tier("80000", "150000", "70"),
            tier("150000", "225000", "75"),
            tier("225000", "310000", "80"),
            tier("310000", "400000", "84"),
            tier("400000", "500000", "88"),
            tier("500000", "650000", "90"),
            tier("650000", null, "92")));

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SupportAgentTier {

        private BigDecimal minGci;

        /**
         * Exclusive. Null for the open-ended top band.
         */
        private BigDecimal maxGci;

        private BigDecimal percentage;

        public boolean contains(BigDecimal gci) {
            return gci.compareTo(minGci) >= 0 && (maxGci == null || gci.compareTo(maxGci) < 0);
        }
    }

    private static SupportAgentTier tier(String minGci, String maxGci, String percentage) {
        return new SupportAgentTier(new BigDecimal(minGci),
                maxGci != null ? new BigDecimal(maxGci) : null,
                new BigDecimal(percentage));
    }
}
