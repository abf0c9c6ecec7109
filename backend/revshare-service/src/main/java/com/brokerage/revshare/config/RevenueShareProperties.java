package com.brokerage.revshare.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Revenue share rates and annual caps.
 *
 * YAML Configuration:
 * <pre>
 * brokerage:
 *   revenue-share:
 *     principal-rate: 0.125
 *     support-rate: 0.02
 *     standard-cap: 2000
 *     team-cap: 1000
 *     support-cap: 2000
 *     max-tiers: 5
 *     company-gci-rate: 0.15
 *     time-zone: UTC
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "brokerage.revenue-share")
public class RevenueShareProperties {

    /**
     * Fraction of company GCI paid to a principal sponsor at any tier.
     */
    private BigDecimal principalRate = new BigDecimal("0.125");

    /**
     * Fraction of company GCI paid to a support sponsor at any tier.
     */
    private BigDecimal supportRate = new BigDecimal("0.02");

    /**
     * Annual ceiling per sponsor/source pair for principals on the standard cap.
     */
    private BigDecimal standardCap = new BigDecimal("2000");

    /**
     * Annual ceiling per sponsor/source pair for principals on the team cap.
     */
    private BigDecimal teamCap = new BigDecimal("1000");

    /**
     * Annual ceiling per sponsor/source pair for support sponsors.
     */
    private BigDecimal supportCap = new BigDecimal("2000");

    /**
     * Upline depth walked per transaction. Never more than 5.
     */
    private int maxTiers = 5;

    /**
     * Share of total commission retained by the company when a transaction
     * is entered without an explicit company GCI.
     */
    private BigDecimal companyGciRate = new BigDecimal("0.15");

    /**
     * Zone used to find January 1 when bucketing payouts by calendar year.
     */
    private String timeZone = "UTC";
}
