package com.brokerage.revshare.entity;

/**
 * Cap plan of a principal agent. Support agents carry no cap type.
 */
public enum CapType {
    STANDARD,
    TEAM
}
