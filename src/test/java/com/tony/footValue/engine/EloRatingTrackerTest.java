package com.tony.footValue.engine;

import com.tony.footValue.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.tony.footValue.engine.MatchHistoryFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EloRatingTrackerTest {

    private final EloParameters params = EloParameters.defaults();

    @Test
    @DisplayName("Victoire à domicile entre deux équipes à 1500 : mise à jour K * (réel - attendu)")
    void homeWinUpdatesBothRatings() {
        EloRatingTracker tracker = EloRatingTracker.replay(
                List.of(MatchRecord.finished(1L, LEAGUE, 1L, 2L, day(0), 1, 0)), params);

        double expectedHome = 1.0 / (1.0 + Math.pow(10.0, (1500.0 - 1600.0) / 400.0));
        assertThat(tracker.currentRating(1L)).isCloseTo(1500.0 + 32.0 * (1.0 - expectedHome), within(1e-9));
        assertThat(tracker.currentRating(2L)).isCloseTo(1500.0 - 32.0 * (1.0 - expectedHome), within(1e-9));
        assertThat(tracker.currentRating(1L) + tracker.currentRating(2L)).isCloseTo(3000.0, within(1e-9));
    }

    @Test
    void drawAtHomeCostsTheFavouredHost() {
        EloRatingTracker tracker = EloRatingTracker.replay(
                List.of(MatchRecord.finished(1L, LEAGUE, 1L, 2L, day(0), 1, 1)), params);

        assertThat(tracker.currentRating(1L)).isLessThan(1500.0);
        assertThat(tracker.currentRating(2L)).isGreaterThan(1500.0);
    }

    @Test
    void expectedScoresSumToOne() {
        EloRatingTracker tracker = EloRatingTracker.empty(params);

        for (double home = 1200; home <= 1900; home += 70) {
            for (double away = 1200; away <= 1900; away += 70) {
                ExpectedScores scores = tracker.expectedScores(home, away);
                assertThat(scores.home() + scores.away()).isCloseTo(1.0, within(1e-12));
                assertThat(scores.home()).isBetween(0.0, 1.0);
            }
        }
    }

    @Test
    @DisplayName("ratingAsOf : la note d'un jour de match est celle d'avant le match")
    void ratingAsOfIgnoresMatchesOnOrAfterDate() {
        EloRatingTracker tracker = EloRatingTracker.replay(miniLeague(), params);

        assertThat(tracker.ratingAsOf(1L, day(0))).isEqualTo(1500.0);
        assertThat(tracker.ratingAsOf(1L, day(1))).isEqualTo(tracker.history(1L).get(0).rating());
        assertThat(tracker.ratingAsOf(1L, day(28))).isEqualTo(tracker.history(1L).get(3).rating());
        assertThat(tracker.ratingAsOf(1L, day(100))).isEqualTo(tracker.currentRating(1L));
    }

    @Test
    void ratingAsOfIsDeterministic() {
        EloRatingTracker tracker = EloRatingTracker.replay(miniLeague(), params);

        assertThat(tracker.ratingAsOf(3L, day(20))).isEqualTo(tracker.ratingAsOf(3L, day(20)));
    }

    @Test
    void unknownTeamStartsAtInitialRating() {
        EloRatingTracker tracker = EloRatingTracker.replay(miniLeague(), params);

        assertThat(tracker.ratingAsOf(77L, day(10))).isEqualTo(1500.0);
        assertThat(tracker.history(77L)).isEmpty();
    }

    @Test
    @DisplayName("Le rejeu trie l'entrée : l'ordre fourni n'a aucune influence")
    void replayIsIndependentOfInputOrder() {
        List<MatchRecord> shuffled = new ArrayList<>(miniLeague());
        Collections.reverse(shuffled);

        EloRatingTracker ordered = EloRatingTracker.replay(miniLeague(), params);
        EloRatingTracker reversed = EloRatingTracker.replay(shuffled, params);

        for (long team = 1; team <= 4; team++) {
            assertThat(reversed.currentRating(team)).isEqualTo(ordered.currentRating(team));
            assertThat(reversed.history(team)).isEqualTo(ordered.history(team));
        }
        assertThat(ordered.processedMatches()).isEqualTo(5);
    }

    @Test
    void unfinishedMatchesAreNotReplayed() {
        List<MatchRecord> matches = new ArrayList<>(miniLeague());
        matches.add(MatchRecord.scheduled(9L, LEAGUE, 2L, 3L, day(40)));

        EloRatingTracker tracker = EloRatingTracker.replay(matches, params);

        assertThat(tracker.processedMatches()).isEqualTo(5);
    }

    @Test
    void predictSplitsProbabilitiesWithDrawFloor() {
        EloRatingTracker tracker = EloRatingTracker.empty(params);

        EloPrediction even = tracker.predict(1L, 2L, day(0));
        assertThat(even.draw()).isCloseTo(0.35, within(1e-12));
        assertThat(even.homeWin() + even.draw() + even.awayWin()).isCloseTo(1.0, within(1e-12));
        assertThat(even.homeWin()).isGreaterThan(even.awayWin());
    }

    @Test
    void drawProbabilityNeverFallsBelowFloor() {
        List<MatchRecord> rout = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            rout.add(MatchRecord.finished((long) i + 1, LEAGUE, 1L, 2L, day(i), 5, 0));
        }
        EloRatingTracker tracker = EloRatingTracker.replay(rout, params);

        EloPrediction prediction = tracker.predict(1L, 2L, day(100));
        assertThat(prediction.draw()).isEqualTo(0.15);
        assertThat(prediction.homeWin() + prediction.draw() + prediction.awayWin()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void topTeamsAreSortedByRating() {
        EloRatingTracker tracker = EloRatingTracker.replay(miniLeague(), params);

        List<TeamRating> top = tracker.topTeams(2);

        assertThat(top).hasSize(2);
        assertThat(top.get(0).rating()).isGreaterThanOrEqualTo(top.get(1).rating());
        // Équipe 4 : un seul match, gagné à l'extérieur chez l'équipe 1 alors mieux notée
        long leader = 1L;
        for (long team = 2L; team <= 4L; team++) {
            if (tracker.currentRating(team) > tracker.currentRating(leader)) leader = team;
        }
        assertThat(leader).isEqualTo(4L);
        assertThat(top.get(0).teamId()).isEqualTo(leader);
        assertThat(top.get(0).rating()).isEqualTo(tracker.currentRating(4L));
    }

    @Test
    void mergeRejectsTeamsPresentInTwoReplays() {
        EloRatingTracker first = EloRatingTracker.replay(List.of(MatchRecord.finished(1L, 1L, 1L, 2L, day(0), 1, 0)), params);
        EloRatingTracker second = EloRatingTracker.replay(List.of(MatchRecord.finished(2L, 2L, 2L, 3L, day(0), 1, 0)), params);

        assertThatThrownBy(() -> EloRatingTracker.merge(List.of(first, second), params))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidQueriesAreRejected() {
        EloRatingTracker tracker = EloRatingTracker.empty(params);

        assertThatThrownBy(() -> tracker.ratingAsOf(0L, day(0))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> tracker.ratingAsOf(1L, null)).isInstanceOf(ValidationException.class);
    }
}
