package com.brokerage.revshare.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Published after a transaction write. Listeners run once the database commit succeeds.
 */
@Value
@Builder
public class TransactionEvent {

    TransactionEventType type;
    Long transactionId;
    Long agentId;
    BigDecimal companyGci;
    boolean revenueSharesRecalculated;
    int revenueShareCount;
}
