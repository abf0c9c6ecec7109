package com.brokerage.revshare.service;

import com.brokerage.revshare.config.RevenueShareProperties;
import com.brokerage.revshare.dto.AllowanceDto;
import com.brokerage.revshare.entity.Agent;
import com.brokerage.revshare.entity.AgentType;
import com.brokerage.revshare.entity.CapType;
import com.brokerage.revshare.exception.ResourceNotFoundException;
import com.brokerage.revshare.repository.AgentRepository;
import com.brokerage.revshare.repository.RevenueShareRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RevenueShareServiceTest {

    private static final LocalDateTime YEAR_START = LocalDateTime.of(2025, 1, 1, 0, 0);

    @Mock
    private RevenueShareRepository revenueShareRepository;
    @Mock
    private AgentRepository agentRepository;

    private RevenueShareService revenueShareService;

    @BeforeEach
    void setup() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);
        revenueShareService = new RevenueShareService(revenueShareRepository, agentRepository,
                new RevenueSharePolicy(new RevenueShareProperties()),
                new AnnualPayoutLedger(revenueShareRepository, clock));
    }

    private void principal(long id, CapType capType) {
        when(agentRepository.findById(id)).thenReturn(Optional.of(Agent.builder()
                .id(id).name("Avery").agentType(AgentType.PRINCIPAL).capType(capType).build()));
    }

    @Test
    void allowance_reportsCapPaidAndRemaining() {
        principal(10L, CapType.STANDARD);
        when(revenueShareRepository.sumAmountByRecipientAndSourceSince(10L, 20L, YEAR_START))
                .thenReturn(new BigDecimal("1900.00"));

        AllowanceDto allowance = revenueShareService.getAllowance(10L, 20L);

        assertThat(allowance.getCap()).isEqualByComparingTo("2000");
        assertThat(allowance.getPaidThisYear()).isEqualByComparingTo("1900");
        assertThat(allowance.getRemaining()).isEqualByComparingTo("100");
        assertThat(allowance.getYearStart()).isEqualTo(YEAR_START);
    }

    @Test
    void allowance_afterClampedPayout_hasNothingRemaining() {
        principal(10L, CapType.TEAM);
        when(revenueShareRepository.sumAmountByRecipientAndSourceSince(10L, 20L, YEAR_START))
                .thenReturn(new BigDecimal("1000.00"));

        AllowanceDto allowance = revenueShareService.getAllowance(10L, 20L);

        assertThat(allowance.getCap()).isEqualByComparingTo("1000");
        assertThat(allowance.getRemaining()).isEqualByComparingTo("0");
    }

    @Test
    void allowance_withoutPayouts_isTheFullCap() {
        principal(10L, CapType.STANDARD);
        when(revenueShareRepository.sumAmountByRecipientAndSourceSince(10L, 20L, YEAR_START)).thenReturn(null);

        AllowanceDto allowance = revenueShareService.getAllowance(10L, 20L);

        assertThat(allowance.getPaidThisYear()).isEqualByComparingTo("0");
        assertThat(allowance.getRemaining()).isEqualByComparingTo("2000");
    }

    @Test
    void allowance_forUnknownRecipient_throwsNotFound() {
        when(agentRepository.findById(99L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> revenueShareService.getAllowance(99L, 20L));
    }
}
