package com.tony.footValue.repository;

import com.tony.footValue.engine.MatchRecord;
import com.tony.footValue.engine.TeamRecord;
import com.tony.footValue.exception.UnknownEntityException;
import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.Match;
import com.tony.footValue.model.MatchStatus;
import com.tony.footValue.model.Team;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaMatchHistoryStore implements MatchHistoryStore {

    private static final Set<MatchStatus> SCHEDULED = Arrays.stream(MatchStatus.values())
            .filter(MatchStatus::isScheduled)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(MatchStatus.class)));

    private final MatchRepository matchRepository;
    private final TeamRepository teamRepository;
    private final LeagueRepository leagueRepository;

    @Override
    public List<MatchRecord> listFinishedMatches(LocalDateTime before, Collection<Long> leagueIds) {
        List<Match> matches = (leagueIds == null || leagueIds.isEmpty())
                ? matchRepository.findFinished(MatchStatus.FT, before)
                : matchRepository.findFinishedInLeagues(MatchStatus.FT, before, leagueIds);
        return matches.stream().map(Match::toRecord).toList();
    }

    @Override
    public List<TeamRecord> listTeams(Long leagueId) {
        if (leagueId == null || !leagueRepository.existsById(leagueId)) {
            throw new UnknownEntityException("Ligue", leagueId);
        }
        return teamRepository.findByLeagueId(leagueId).stream().map(Team::toRecord).toList();
    }

    @Override
    public List<Long> listLeagueIds() {
        return leagueRepository.findAllIds();
    }

    @Override
    public List<MatchRecord> listUpcomingMatches(LocalDateTime from, LocalDateTime to) {
        if (from == null || to == null || !from.isBefore(to)) {
            throw new ValidationException("Fenêtre de dates invalide : " + from + " -> " + to);
        }
        return matchRepository.findUpcoming(SCHEDULED, from, to)
                .stream().map(Match::toRecord).toList();
    }

    @Override
    public Optional<MatchRecord> findMatch(Long matchId) {
        if (matchId == null) {
            return Optional.empty();
        }
        return matchRepository.findById(matchId).map(Match::toRecord);
    }
}
