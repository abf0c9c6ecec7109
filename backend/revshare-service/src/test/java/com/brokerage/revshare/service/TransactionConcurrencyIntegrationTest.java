package com.brokerage.revshare.service;

import com.brokerage.revshare.dto.CreateAgentRequest;
import com.brokerage.revshare.dto.CreateTransactionRequest;
import com.brokerage.revshare.dto.TransactionUpdateRequest;
import com.brokerage.revshare.entity.Agent;
import com.brokerage.revshare.entity.AgentType;
import com.brokerage.revshare.entity.CapType;
import com.brokerage.revshare.entity.RevenueShare;
import com.brokerage.revshare.entity.Transaction;
import com.brokerage.revshare.repository.AgentRepository;
import com.brokerage.revshare.repository.RevenueShareRepository;
import com.brokerage.revshare.repository.TransactionRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Concurrent edits of one transaction must leave exactly one set of revenue shares behind.
 */
@SpringBootTest
class TransactionConcurrencyIntegrationTest {

    private static final int THREADS = 8;
    private static final int UPDATES = 40;

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private AgentService agentService;
    @Autowired
    private TransactionService transactionService;
    @Autowired
    private RevenueShareService revenueShareService;
    @Autowired
    private AgentRepository agentRepository;
    @Autowired
    private TransactionRepository transactionRepository;
    @Autowired
    private RevenueShareRepository revenueShareRepository;

    private ExecutorService executor;
    private Agent avery;
    private Agent blake;
    private Agent casey;

    @BeforeEach
    void setup() {
        revenueShareRepository.deleteAll();
        transactionRepository.deleteAll();
        agentRepository.deleteAll();

        avery = agentService.createAgent(CreateAgentRequest.builder()
                .name("Avery").agentType(AgentType.PRINCIPAL).capType(CapType.STANDARD).build());
        blake = agentService.createAgent(CreateAgentRequest.builder()
                .name("Blake").agentType(AgentType.PRINCIPAL).capType(CapType.STANDARD)
                .sponsorId(avery.getId()).build());
        casey = agentService.createAgent(CreateAgentRequest.builder()
                .name("Casey").agentType(AgentType.SUPPORT).sponsorId(blake.getId()).build());

        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void shutdown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(10, TimeUnit.SECONDS);
    }

    @Test
    void concurrentGciUpdates_leaveOneSetOfShares() throws Exception {
        Transaction transaction = transactionService.createTransaction(CreateTransactionRequest.builder()
                .agentId(casey.getId())
                .propertyAddress("12 Harbor View")
                .saleAmount(new BigDecimal("500000"))
                .commissionPercentage(new BigDecimal("3"))
                .companyGci(new BigDecimal("10000"))
                .transactionDate(LocalDate.of(2025, 6, 1))
                .build());
        Long id = transaction.getId();

        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < UPDATES; i++) {
            BigDecimal gci = new BigDecimal(1000 + i);
            futures.add(executor.submit(() -> transactionService.updateTransaction(id,
                    TransactionUpdateRequest.builder().companyGci(gci).build())));
        }
        for (Future<?> future : futures) {
            // rethrows any failed update
            future.get(60, TimeUnit.SECONDS);
        }

        BigDecimal finalGci = transactionRepository.findById(id).orElseThrow().getCompanyGci();
        BigDecimal expected = finalGci.multiply(new BigDecimal("0.125")).setScale(2, RoundingMode.HALF_UP);

        List<RevenueShare> shares = revenueShareRepository.findByTransactionIdOrderByTierAsc(id);
        assertThat(shares)
                .extracting(RevenueShare::getTier, RevenueShare::getRecipientAgentId)
                .containsExactly(tuple(1, blake.getId()), tuple(2, avery.getId()));
        assertThat(shares).allSatisfy(s -> assertThat(s.getAmount()).isEqualByComparingTo(expected));
        assertThat(revenueShareRepository.count()).isEqualTo(2);

        assertThat(revenueShareService.getAllowance(blake.getId(), casey.getId()))
                .satisfies(allowance -> {
                    assertThat(allowance.getPaidThisYear()).isEqualByComparingTo(expected);
                    assertThat(allowance.getRemaining())
                            .isEqualByComparingTo(new BigDecimal("2000").subtract(expected));
                });
    }
}
