package com.brokerage.revshare.repository;

import com.brokerage.revshare.entity.Transaction;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface TransactionRepository extends JpaRepository<Transaction, Long> {

    List<Transaction> findAllByOrderByTransactionDateDescIdDesc();

    List<Transaction> findByAgentIdOrderByTransactionDateDescIdDesc(Long agentId);

    boolean existsByAgentId(Long agentId);

    /**
     * Null when the agent has no transactions dated on or after {@code since}.
     */
    @Query("SELECT SUM(t.companyGci) FROM Transaction t WHERE t.agentId = :agentId AND t.transactionDate >= :since")
    BigDecimal sumCompanyGciByAgentIdSince(Long agentId, LocalDate since);

    /**
     * Row lock held until the surrounding transaction ends. Serializes revenue share
     * regeneration for one transaction id.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Transaction t WHERE t.id = :id")
    Optional<Transaction> findLockedById(Long id);
}
