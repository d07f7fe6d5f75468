package com.tony.footValue.engine;

/**
 * Attaque / défense relatives à la moyenne de la ligue (1.0 = moyenne).
 * Défense &gt; 1 : l'équipe encaisse plus que la moyenne.
 */
public record TeamStrength(double attack, double defense) {

    public static final TeamStrength NEUTRAL = new TeamStrength(1.0, 1.0);
}
