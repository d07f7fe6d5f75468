package com.tony.footValue.engine;

public record ScoreProbability(int homeGoals, int awayGoals, double probability) {

    public String label() {
        return homeGoals + "-" + awayGoals;
    }
}
