package com.brokerage.revshare.entity;

/**
 * Transaction pipeline status
 */
public enum TransactionStatus {
    PENDING,
    CLOSED,
    CANCELLED
}
