package com.tony.footValue.engine;

/**
 * @param decay             poids du match i positions en arrière : decay^i
 * @param defaultLeagueSize taille de ligue supposée quand aucune équipe n'est connue
 * @param defaultRestDays   repos supposé sans match précédent
 * @param maxRestDays       plafond du repos
 */
public record StatsParameters(double decay, int defaultLeagueSize, int defaultRestDays, int maxRestDays) {

    public static StatsParameters defaults() {
        return new StatsParameters(0.85, 20, 14, 30);
    }
}
