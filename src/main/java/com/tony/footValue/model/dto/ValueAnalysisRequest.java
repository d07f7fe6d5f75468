package com.tony.footValue.model.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ValueAnalysisRequest {
    private String market; // Optionnel : analyse brute sinon

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double probability;

    @DecimalMin("1.0")
    private Double price;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double maxKellyFraction;
}
