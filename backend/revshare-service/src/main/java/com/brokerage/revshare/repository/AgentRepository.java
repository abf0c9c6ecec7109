package com.brokerage.revshare.repository;

import com.brokerage.revshare.entity.Agent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AgentRepository extends JpaRepository<Agent, Long> {

    List<Agent> findAllByOrderByNameAsc();

    List<Agent> findBySponsorIdIsNullOrderByNameAsc();

    List<Agent> findBySponsorIdOrderByNameAsc(Long sponsorId);

    boolean existsBySponsorId(Long sponsorId);

    boolean existsByAgentCode(String agentCode);
}
