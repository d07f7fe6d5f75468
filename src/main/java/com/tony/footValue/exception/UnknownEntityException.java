package com.tony.footValue.exception;

/**
 * Équipe, ligue, match ou pari inconnu.
 */
public class UnknownEntityException extends ValidationException {

    public UnknownEntityException(String message) {
        super(message);
    }

    public UnknownEntityException(String entityType, Object id) {
        super(String.format("%s introuvable : %s", entityType, id));
    }
}
