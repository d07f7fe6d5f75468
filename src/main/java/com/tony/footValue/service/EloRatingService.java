package com.tony.footValue.service;

import com.tony.footValue.config.PredictionProperties;
import com.tony.footValue.engine.EloParameters;
import com.tony.footValue.engine.EloRatingTracker;
import com.tony.footValue.engine.MatchRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class EloRatingService {

    private final PredictionProperties properties;

    /**
     * Rejoue l'historique complet. Les ligues sont rejouées en parallèle seulement si
     * aucune équipe n'apparaît dans deux ligues ; sinon un seul rejeu séquentiel.
     */
    public EloRatingTracker replay(Collection<MatchRecord> history) {
        EloParameters params = properties.toEloParameters();
        Map<Long, List<MatchRecord>> byLeague = groupByLeague(history);

        if (byLeague == null || byLeague.size() <= 1 || !hasDisjointTeams(byLeague)) {
            return EloRatingTracker.replay(history, params);
        }

        log.debug("⚡ Rejeu Elo parallèle sur {} ligues indépendantes", byLeague.size());
        List<EloRatingTracker> parts = byLeague.values().parallelStream()
                .map(matches -> EloRatingTracker.replay(matches, params))
                .toList();
        return EloRatingTracker.merge(parts, params);
    }

    // null si un match n'a pas de ligue : rejeu séquentiel
    private Map<Long, List<MatchRecord>> groupByLeague(Collection<MatchRecord> history) {
        Map<Long, List<MatchRecord>> byLeague = new HashMap<>();
        for (MatchRecord m : history) {
            if (m.leagueId() == null) {
                return null;
            }
            byLeague.computeIfAbsent(m.leagueId(), id -> new ArrayList<>()).add(m);
        }
        return byLeague;
    }

    static boolean hasDisjointTeams(Map<Long, List<MatchRecord>> byLeague) {
        Map<Long, Long> teamLeague = new HashMap<>();
        for (Map.Entry<Long, List<MatchRecord>> entry : byLeague.entrySet()) {
            Set<Long> teams = new HashSet<>();
            for (MatchRecord m : entry.getValue()) {
                teams.add(m.homeTeamId());
                teams.add(m.awayTeamId());
            }
            for (Long team : teams) {
                Long previous = teamLeague.putIfAbsent(team, entry.getKey());
                if (previous != null && !previous.equals(entry.getKey())) {
                    return false;
                }
            }
        }
        return true;
    }
}
