package com.brokerage.revshare.repository;

import com.brokerage.revshare.entity.RevenueShare;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface RevenueShareRepository extends JpaRepository<RevenueShare, Long> {

    List<RevenueShare> findAllByOrderByCreatedAtDescIdDesc();

    List<RevenueShare> findByTransactionIdOrderByTierAsc(Long transactionId);

    @Query("SELECT r FROM RevenueShare r WHERE r.recipientAgentId = :agentId OR r.sourceAgentId = :agentId " +
            "ORDER BY r.createdAt DESC, r.id DESC")
    List<RevenueShare> findByAgentId(Long agentId);

    boolean existsByRecipientAgentIdOrSourceAgentId(Long recipientAgentId, Long sourceAgentId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM RevenueShare r WHERE r.transactionId = :transactionId")
    int deleteByTransactionId(Long transactionId);

    /**
     * Null when the pair has no payouts since the given instant.
     */
    @Query("SELECT SUM(r.amount) FROM RevenueShare r WHERE r.recipientAgentId = :recipientAgentId " +
            "AND r.sourceAgentId = :sourceAgentId AND r.createdAt >= :since")
    BigDecimal sumAmountByRecipientAndSourceSince(Long recipientAgentId, Long sourceAgentId, LocalDateTime since);

    @Query("SELECT SUM(r.amount) FROM RevenueShare r WHERE r.recipientAgentId = :recipientAgentId")
    BigDecimal sumAmountByRecipientAgentId(Long recipientAgentId);
}
