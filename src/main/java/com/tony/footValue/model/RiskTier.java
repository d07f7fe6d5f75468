package com.tony.footValue.model;

public enum RiskTier {
    NONE, LOW, MEDIUM, HIGH
}
