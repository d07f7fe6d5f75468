package com.tony.footValue.model.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class PlaceBetRequest {
    @NotNull(message = "Le match est requis")
    private Long matchId;

    @NotBlank(message = "Le marché est requis (H, D, A, Over2.5, 1_btts...)")
    private String market;

    @NotNull
    @DecimalMin(value = "0.0", message = "La probabilité doit être >= 0")
    @DecimalMax(value = "1.0", message = "La probabilité doit être <= 1")
    private Double probability;

    // Absente : cote estimée avec la marge bookmaker configurée
    @DecimalMin(value = "1.0", message = "La cote doit être >= 1.0")
    private Double price;

    // Absente : bankroll initiale configurée
    @Positive
    private Double bankroll;

    private String notes;
}
