package com.tony.footValue.repository;

import com.tony.footValue.engine.MatchRecord;
import com.tony.footValue.engine.TeamRecord;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Source en lecture seule des matchs, équipes et ligues.
 * Les batchs l'interrogent une fois en masse, jamais par feature.
 */
public interface MatchHistoryStore {

    /**
     * Matchs terminés (FT, score connu) triés par date croissante.
     * @param before    borne exclusive, {@code null} = tout l'historique
     * @param leagueIds filtre de ligues, {@code null} ou vide = toutes
     */
    List<MatchRecord> listFinishedMatches(LocalDateTime before, Collection<Long> leagueIds);

    /** @throws com.tony.footValue.exception.UnknownEntityException si la ligue n'existe pas */
    List<TeamRecord> listTeams(Long leagueId);

    List<Long> listLeagueIds();

    /** Matchs programmés (NS / TBD) dans [from, to). */
    List<MatchRecord> listUpcomingMatches(LocalDateTime from, LocalDateTime to);

    Optional<MatchRecord> findMatch(Long matchId);
}
