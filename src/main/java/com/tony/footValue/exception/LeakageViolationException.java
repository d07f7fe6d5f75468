package com.tony.footValue.exception;

/**
 * Une fenêtre de stats contient un match daté au moment ou après la date de coupure.
 * Violation de contrat interne : ne doit jamais arriver.
 */
public class LeakageViolationException extends IllegalStateException {

    public LeakageViolationException(String message) {
        super(message);
    }
}
