package com.tony.footValue.engine;

import com.tony.footValue.exception.ValidationException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Classement Elo rejoué dans l'ordre chronologique strict (date puis id) sur l'historique complet.
 * Le rejeu est séquentiel : chaque mise à jour dépend de l'état précédent des deux équipes.
 * Immuable une fois construit.
 */
public final class EloRatingTracker {

    private static final double ELO_DIVISOR = 400.0;

    // --- Heuristique du nul (prédiction Elo seule) ---
    private static final double BASE_DRAW = 0.35;
    private static final double MIN_DRAW = 0.15;
    private static final double DRAW_DECAY = 1000.0;

    private final EloParameters params;
    private final Map<Long, RatingState> states;
    private final int processedMatches;

    private EloRatingTracker(EloParameters params, Map<Long, RatingState> states, int processedMatches) {
        this.params = params;
        this.states = states;
        this.processedMatches = processedMatches;
    }

    public static EloRatingTracker empty(EloParameters params) {
        return new EloRatingTracker(params, Map.of(), 0);
    }

    /**
     * Rejoue tous les matchs terminés. L'entrée n'a pas besoin d'être triée.
     */
    public static EloRatingTracker replay(Collection<MatchRecord> matches, EloParameters params) {
        List<MatchRecord> ordered = new ArrayList<>();
        for (MatchRecord m : matches) {
            if (m.isFinished()) ordered.add(m);
        }
        ordered.sort(MatchRecord.CHRONOLOGICAL);

        Map<Long, Double> current = new HashMap<>();
        Map<Long, List<RatingPoint>> history = new HashMap<>();

        for (MatchRecord m : ordered) {
            double home = current.getOrDefault(m.homeTeamId(), params.initialRating());
            double away = current.getOrDefault(m.awayTeamId(), params.initialRating());

            double expectedHome = expectedHome(home, away, params.homeBonus());
            double actualHome = m.homeGoals() > m.awayGoals() ? 1.0 : (m.homeGoals().equals(m.awayGoals()) ? 0.5 : 0.0);

            // Nouveau = Ancien + K * (Réel - Attendu)
            double newHome = home + params.kFactor() * (actualHome - expectedHome);
            double newAway = away + params.kFactor() * ((1.0 - actualHome) - (1.0 - expectedHome));

            current.put(m.homeTeamId(), newHome);
            current.put(m.awayTeamId(), newAway);
            history.computeIfAbsent(m.homeTeamId(), id -> new ArrayList<>()).add(new RatingPoint(m.matchDate(), newHome, m.id()));
            history.computeIfAbsent(m.awayTeamId(), id -> new ArrayList<>()).add(new RatingPoint(m.matchDate(), newAway, m.id()));
        }

        Map<Long, RatingState> states = new HashMap<>();
        current.forEach((team, rating) -> states.put(team, new RatingState(team, rating, history.get(team))));
        return new EloRatingTracker(params, Collections.unmodifiableMap(states), ordered.size());
    }

    /**
     * Fusionne des rejeux indépendants (ligues sans équipe commune).
     * @throws IllegalArgumentException si une équipe apparaît dans deux rejeux
     */
    public static EloRatingTracker merge(Collection<EloRatingTracker> parts, EloParameters params) {
        Map<Long, RatingState> states = new HashMap<>();
        int processed = 0;
        for (EloRatingTracker part : parts) {
            for (RatingState state : part.states.values()) {
                if (states.putIfAbsent(state.teamId(), state) != null) {
                    throw new IllegalArgumentException("Équipe " + state.teamId() + " présente dans deux rejeux Elo");
                }
            }
            processed += part.processedMatches;
        }
        return new EloRatingTracker(params, Collections.unmodifiableMap(states), processed);
    }

    /** Espérance de score domicile, bonus domicile inclus. */
    static double expectedHome(double homeRating, double awayRating, double homeBonus) {
        return 1.0 / (1.0 + Math.pow(10.0, (awayRating - (homeRating + homeBonus)) / ELO_DIVISOR));
    }

    public ExpectedScores expectedScores(double homeRating, double awayRating) {
        double home = expectedHome(homeRating, awayRating, params.homeBonus());
        return new ExpectedScores(home, 1.0 - home);
    }

    /**
     * Elo de l'équipe juste avant {@code date} : aucun match à cette date ou après n'est pris en compte.
     */
    public double ratingAsOf(long teamId, LocalDateTime date) {
        requireTeamId(teamId);
        if (date == null) {
            throw new ValidationException("La date est requise");
        }
        RatingState state = states.get(teamId);
        return state == null ? params.initialRating() : state.valueAsOf(date, params.initialRating());
    }

    public double currentRating(long teamId) {
        requireTeamId(teamId);
        RatingState state = states.get(teamId);
        return state == null ? params.initialRating() : state.current();
    }

    public List<RatingPoint> history(long teamId) {
        requireTeamId(teamId);
        RatingState state = states.get(teamId);
        return state == null ? List.of() : state.history();
    }

    /**
     * Prédiction 1X2 Elo seule, avec les notes d'avant-match.
     * Le nul décroît avec l'écart de niveau (plancher 15%), le reste est partagé au prorata des espérances.
     */
    public EloPrediction predict(long homeTeamId, long awayTeamId, LocalDateTime asOf) {
        double home = ratingAsOf(homeTeamId, asOf);
        double away = ratingAsOf(awayTeamId, asOf);
        ExpectedScores expected = expectedScores(home, away);

        double draw = Math.max(MIN_DRAW, BASE_DRAW - Math.abs(home - away) / DRAW_DECAY);
        double homeWin = expected.home() * (1.0 - draw);
        double awayWin = expected.away() * (1.0 - draw);
        return new EloPrediction(home, away, homeWin, draw, awayWin);
    }

    public List<TeamRating> topTeams(int limit) {
        return states.values().stream()
                .map(s -> new TeamRating(s.teamId(), s.current(), s.history().size()))
                .sorted(Comparator.comparingDouble(TeamRating::rating).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    public int processedMatches() {
        return processedMatches;
    }

    public int trackedTeams() {
        return states.size();
    }

    public EloParameters parameters() {
        return params;
    }

    private static void requireTeamId(long teamId) {
        if (teamId <= 0) {
            throw new ValidationException("Identifiant d'équipe invalide : " + teamId);
        }
    }
}
