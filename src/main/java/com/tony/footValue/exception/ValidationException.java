package com.tony.footValue.exception;

/**
 * Entrée mal formée (probabilité hors [0,1], cote &lt; 1, identifiant invalide...).
 * Toujours remontée à l'appelant, jamais corrigée en silence.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
