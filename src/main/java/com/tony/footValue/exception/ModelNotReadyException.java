package com.tony.footValue.exception;

public class ModelNotReadyException extends IllegalStateException {

    public ModelNotReadyException() {
        super("Aucun snapshot de modèle construit. Lancez une reconstruction d'abord.");
    }
}
