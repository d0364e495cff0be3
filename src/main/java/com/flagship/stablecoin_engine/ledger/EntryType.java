package com.flagship.stablecoin_engine.ledger;

/**
 * Direction of a ledger entry. A CREDIT increases the recorded balance,
 * a DEBIT decreases it and may never exceed it.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
