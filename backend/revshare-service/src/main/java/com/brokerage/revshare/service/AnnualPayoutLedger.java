package com.brokerage.revshare.service;

import com.brokerage.revshare.repository.RevenueShareRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Amounts already paid per sponsor/source pair in the current calendar year, read
 * straight from the revenue share table.
 */
@Component
@RequiredArgsConstructor
public class AnnualPayoutLedger {

    private final RevenueShareRepository revenueShareRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public BigDecimal totalPaid(Long recipientAgentId, Long sourceAgentId, LocalDateTime since) {
        BigDecimal total = revenueShareRepository.sumAmountByRecipientAndSourceSince(
                recipientAgentId, sourceAgentId, since);
        return total != null ? total : BigDecimal.ZERO;
    }

    @Transactional(readOnly = true)
    public BigDecimal paidThisYear(Long recipientAgentId, Long sourceAgentId) {
        return totalPaid(recipientAgentId, sourceAgentId, startOfCurrentYear());
    }

    /**
     * January 1, 00:00 of the current year in the clock's zone
     */
    public LocalDateTime startOfCurrentYear() {
        return LocalDate.now(clock).withDayOfYear(1).atStartOfDay();
    }

    public BigDecimal remainingAllowance(BigDecimal cap, BigDecimal alreadyPaid) {
        BigDecimal remaining = cap.subtract(alreadyPaid);
        return remaining.signum() > 0 ? remaining : BigDecimal.ZERO;
    }
}
