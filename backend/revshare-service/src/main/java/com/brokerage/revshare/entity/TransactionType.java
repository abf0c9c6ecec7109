package com.brokerage.revshare.entity;

public enum TransactionType {
    BUYER,
    SELLER
}
