package com.momentumshift.ledger.service;

/** An append that would overwrite or duplicate an immutable ledger row. */
public class LedgerConflictException extends RuntimeException {

    public LedgerConflictException(String message) {
        super(message);
    }
}
