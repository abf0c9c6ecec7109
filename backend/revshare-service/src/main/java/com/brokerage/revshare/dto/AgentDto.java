package com.brokerage.revshare.dto;

import com.brokerage.revshare.entity.AgentType;
import com.brokerage.revshare.entity.CapType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentDto {

    private Long id;
    private String name;
    private String agentCode;
    private AgentType agentType;
    private CapType capType;
    private Long sponsorId;
    private LocalDate anniversaryDate;
    private LocalDateTime createdAt;
}
