package com.brokerage.revshare.entity;

/**
 * Agent role within the brokerage
 */
public enum AgentType {
    PRINCIPAL,
    SUPPORT
}
