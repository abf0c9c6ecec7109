package com.brokerage.revshare.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Records committed transaction lifecycle events. Outbound notifications hook in here.
 */
@Component
@Slf4j
public class TransactionEventLogger {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTransactionEvent(TransactionEvent event) {
        log.info("Transaction {} {} (agent {}, company GCI {}, revenue shares recalculated: {}, count: {})",
                event.getTransactionId(), event.getType(), event.getAgentId(), event.getCompanyGci(),
                event.isRevenueSharesRecalculated(), event.getRevenueShareCount());
    }
}
