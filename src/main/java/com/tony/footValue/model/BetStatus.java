package com.tony.footValue.model;

public enum BetStatus {
    PENDING, WON, LOST;

    public boolean isSettled() {
        return this != PENDING;
    }
}
