package com.tony.footValue.exception;

/**
 * Tentative de règlement d'un pari qui n'est plus PENDING.
 */
public class SettlementConflictException extends IllegalStateException {

    public SettlementConflictException(String message) {
        super(message);
    }
}
