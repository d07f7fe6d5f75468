package com.tony.footValue.exception;

/**
 * La matrice des scores n'a pas pu être normalisée (masse nulle, NaN, infinie).
 * Fatal uniquement pour le match concerné.
 */
public class ScorelineNormalizationException extends ArithmeticException {

    public ScorelineNormalizationException(String message) {
        super(message);
    }
}
