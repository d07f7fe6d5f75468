package com.tony.footValue.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Tous les marchés que le moteur sait pricer et régler.
 * Chaque marché porte son prédicat gagnant sur le score final, utilisé
 * à la fois pour sommer la matrice des scores et pour régler les paris.
 */
public enum BetMarket {

    // --- 1X2 ---
    HOME_WIN("H", "Victoire domicile", Category.RESULT, (h, a) -> h > a),
    DRAW("D", "Match nul", Category.RESULT, (h, a) -> h == a),
    AWAY_WIN("A", "Victoire extérieur", Category.RESULT, (h, a) -> h < a),

    // --- Double chance ---
    HOME_OR_DRAW("1X", "Domicile ou nul", Category.DOUBLE_CHANCE, (h, a) -> h >= a),
    HOME_OR_AWAY("12", "Domicile ou extérieur", Category.DOUBLE_CHANCE, (h, a) -> h != a),
    DRAW_OR_AWAY("X2", "Nul ou extérieur", Category.DOUBLE_CHANCE, (h, a) -> h <= a),

    // --- Over / Under ---
    OVER_15("Over1.5", "Plus de 1.5 buts", Category.TOTAL_GOALS, (h, a) -> h + a > 1),
    UNDER_15("Under1.5", "Moins de 1.5 buts", Category.TOTAL_GOALS, (h, a) -> h + a <= 1),
    OVER_25("Over2.5", "Plus de 2.5 buts", Category.TOTAL_GOALS, (h, a) -> h + a > 2),
    UNDER_25("Under2.5", "Moins de 2.5 buts", Category.TOTAL_GOALS, (h, a) -> h + a <= 2),
    OVER_35("Over3.5", "Plus de 3.5 buts", Category.TOTAL_GOALS, (h, a) -> h + a > 3),
    UNDER_35("Under3.5", "Moins de 3.5 buts", Category.TOTAL_GOALS, (h, a) -> h + a <= 3),

    // --- Les deux équipes marquent ---
    BTTS_YES("BTTS_Yes", "Les deux équipes marquent", Category.BTTS, (h, a) -> h > 0 && a > 0),
    BTTS_NO("BTTS_No", "Une équipe au moins ne marque pas", Category.BTTS, (h, a) -> h == 0 || a == 0),

    // --- Combinés (lus directement sur la matrice corrélée) ---
    HOME_AND_OVER_25("1_over_25", "Victoire domicile & +2.5 buts", Category.COMBO, (h, a) -> h > a && h + a > 2),
    AWAY_AND_OVER_25("2_over_25", "Victoire extérieur & +2.5 buts", Category.COMBO, (h, a) -> h < a && h + a > 2),
    DRAW_AND_UNDER_25("x_under_25", "Nul & -2.5 buts", Category.COMBO, (h, a) -> h == a && h + a <= 2),
    HOME_AND_BTTS("1_btts", "Victoire domicile & les deux marquent", Category.COMBO, (h, a) -> h > a && a > 0),
    AWAY_AND_BTTS("2_btts", "Victoire extérieur & les deux marquent", Category.COMBO, (h, a) -> h < a && h > 0),
    DRAW_AND_BTTS("x_btts", "Nul & les deux marquent", Category.COMBO, (h, a) -> h == a && h > 0),
    BTTS_AND_OVER_25("gg_over_25", "Les deux marquent & +2.5 buts", Category.COMBO, (h, a) -> h > 0 && a > 0 && h + a > 2);

    public enum Category { RESULT, DOUBLE_CHANCE, TOTAL_GOALS, BTTS, COMBO }

    @FunctionalInterface
    public interface ScorePredicate {
        boolean test(int homeGoals, int awayGoals);
    }

    private final String code;
    private final String label;
    private final Category category;
    private final ScorePredicate outcome;

    BetMarket(String code, String label, Category category, ScorePredicate outcome) {
        this.code = code;
        this.label = label;
        this.category = category;
        this.outcome = outcome;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public Category getCategory() {
        return category;
    }

    public ScorePredicate outcome() {
        return outcome;
    }

    public boolean wins(int homeGoals, int awayGoals) {
        return outcome.test(homeGoals, awayGoals);
    }

    public static Optional<BetMarket> fromCode(String code) {
        return Arrays.stream(values())
                .filter(m -> m.code.equalsIgnoreCase(code))
                .findFirst();
    }

    /** Résultat 1X2 réel ("H", "D" ou "A") d'un score final. */
    public static String resultCode(int homeGoals, int awayGoals) {
        if (homeGoals > awayGoals) return HOME_WIN.code;
        if (homeGoals < awayGoals) return AWAY_WIN.code;
        return DRAW.code;
    }
}
