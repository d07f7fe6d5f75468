package com.tony.footValue.repository;

import com.tony.footValue.model.Match;
import com.tony.footValue.model.MatchStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface MatchRepository extends JpaRepository<Match, Long> {

    // Historique terminé, chargé en une seule requête (équipes et ligue incluses)
    @Query("SELECT m FROM Match m JOIN FETCH m.league JOIN FETCH m.homeTeam JOIN FETCH m.awayTeam " +
            "WHERE m.status = :status AND m.homeGoals IS NOT NULL AND m.awayGoals IS NOT NULL " +
            "AND (CAST(:before AS timestamp) IS NULL OR m.matchDate < :before) " +
            "ORDER BY m.matchDate ASC, m.id ASC")
    List<Match> findFinished(@Param("status") MatchStatus status,
                             @Param("before") LocalDateTime before);

    @Query("SELECT m FROM Match m JOIN FETCH m.league JOIN FETCH m.homeTeam JOIN FETCH m.awayTeam " +
            "WHERE m.status = :status AND m.homeGoals IS NOT NULL AND m.awayGoals IS NOT NULL " +
            "AND m.league.id IN :leagueIds " +
            "AND (CAST(:before AS timestamp) IS NULL OR m.matchDate < :before) " +
            "ORDER BY m.matchDate ASC, m.id ASC")
    List<Match> findFinishedInLeagues(@Param("status") MatchStatus status,
                                      @Param("before") LocalDateTime before,
                                      @Param("leagueIds") Collection<Long> leagueIds);

    // Matchs à venir (non joués) dans une fenêtre de dates
    @Query("SELECT m FROM Match m JOIN FETCH m.league JOIN FETCH m.homeTeam JOIN FETCH m.awayTeam " +
            "WHERE m.status IN :statuses AND m.matchDate >= :from AND m.matchDate < :to " +
            "ORDER BY m.matchDate ASC")
    List<Match> findUpcoming(@Param("statuses") Collection<MatchStatus> statuses,
                             @Param("from") LocalDateTime from,
                             @Param("to") LocalDateTime to);
}
