package com.brokerage.revshare.event;

public enum TransactionEventType {
    CREATED,
    UPDATED,
    DELETED
}
