package com.tony.footValue.engine;

import com.tony.footValue.exception.LeakageViolationException;
import com.tony.footValue.exception.UnknownEntityException;
import com.tony.footValue.exception.ValidationException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Statistiques "point-in-time" : forme, confrontations directes et classement
 * calculés uniquement sur les matchs strictement antérieurs à la date demandée.
 * <p>
 * L'historique complet est chargé une fois à la construction, trié par équipe
 * et par ligue. Chaque requête découpe la liste par recherche dichotomique
 * puis mémoïse le résultat sur le tuple exact de ses entrées.
 * Immuable après construction, sûr en lecture concurrente.
 */
public final class PointInTimeStatsCache {

    private final StatsParameters params;
    private final Map<Long, Long> teamLeagues;
    private final Map<Long, List<MatchRecord>> matchesByTeam;
    private final Map<Long, List<MatchRecord>> matchesByLeague;
    private final Map<Long, Set<Long>> teamsByLeague;

    private final Map<FeatureWindowKey, TeamForm> formCache = new ConcurrentHashMap<>();
    private final Map<HeadToHeadKey, HeadToHead> headToHeadCache = new ConcurrentHashMap<>();
    private final Map<PositionKey, Integer> positionCache = new ConcurrentHashMap<>();

    private record HeadToHeadKey(long teamA, long teamB, LocalDateTime asOf, int window) {}

    private record PositionKey(long teamId, long leagueId, LocalDateTime asOf) {}

    private record Standing(long teamId, int points, int goalDifference, int goalsFor) {}

    private PointInTimeStatsCache(StatsParameters params,
                                  Map<Long, Long> teamLeagues,
                                  Map<Long, List<MatchRecord>> matchesByTeam,
                                  Map<Long, List<MatchRecord>> matchesByLeague,
                                  Map<Long, Set<Long>> teamsByLeague) {
        this.params = params;
        this.teamLeagues = teamLeagues;
        this.matchesByTeam = matchesByTeam;
        this.matchesByLeague = matchesByLeague;
        this.teamsByLeague = teamsByLeague;
    }

    /**
     * Construit le cache à partir de l'historique complet. Seuls les matchs terminés
     * avec un score sont retenus ; les équipes vues dans un match sont connues d'office.
     */
    public static PointInTimeStatsCache build(Collection<MatchRecord> history,
                                              Collection<TeamRecord> teams,
                                              StatsParameters params) {
        Map<Long, Long> teamLeagues = new HashMap<>();
        Map<Long, Set<Long>> teamsByLeague = new HashMap<>();
        Map<Long, List<MatchRecord>> byTeam = new HashMap<>();
        Map<Long, List<MatchRecord>> byLeague = new HashMap<>();

        for (TeamRecord team : teams) {
            if (team.id() == null) continue;
            teamLeagues.put(team.id(), team.leagueId());
            byTeam.computeIfAbsent(team.id(), id -> new ArrayList<>());
            if (team.leagueId() != null) {
                teamsByLeague.computeIfAbsent(team.leagueId(), id -> new HashSet<>()).add(team.id());
            }
        }

        for (MatchRecord match : history) {
            if (!match.isFinished()) continue;
            byTeam.computeIfAbsent(match.homeTeamId(), id -> new ArrayList<>()).add(match);
            byTeam.computeIfAbsent(match.awayTeamId(), id -> new ArrayList<>()).add(match);
            teamLeagues.putIfAbsent(match.homeTeamId(), match.leagueId());
            teamLeagues.putIfAbsent(match.awayTeamId(), match.leagueId());
            if (match.leagueId() != null) {
                byLeague.computeIfAbsent(match.leagueId(), id -> new ArrayList<>()).add(match);
                Set<Long> leagueTeams = teamsByLeague.computeIfAbsent(match.leagueId(), id -> new HashSet<>());
                leagueTeams.add(match.homeTeamId());
                leagueTeams.add(match.awayTeamId());
            }
        }

        return new PointInTimeStatsCache(params,
                Collections.unmodifiableMap(teamLeagues),
                freezeSorted(byTeam),
                freezeSorted(byLeague),
                Collections.unmodifiableMap(teamsByLeague));
    }

    private static Map<Long, List<MatchRecord>> freezeSorted(Map<Long, List<MatchRecord>> source) {
        Map<Long, List<MatchRecord>> frozen = new HashMap<>();
        source.forEach((id, matches) -> {
            matches.sort(MatchRecord.CHRONOLOGICAL);
            frozen.put(id, List.copyOf(matches));
        });
        return Collections.unmodifiableMap(frozen);
    }

    // =================================================================================
    // FORME
    // =================================================================================

    /**
     * Forme sur les {@code window} derniers matchs (filtrés par lieu) avant {@code asOf}.
     * Avec pondération, le match i positions en arrière pèse decay^i ; sans, tous pèsent 1
     * et {@code weightedPoints} vaut la moyenne de points simple.
     */
    public TeamForm form(long teamId, LocalDateTime asOf, int window, Venue venue, boolean weighted) {
        requireTeam(teamId);
        requireDate(asOf);
        requireWindow(window);
        if (venue == null) {
            throw new ValidationException("Le filtre de lieu est requis");
        }
        FeatureWindowKey key = new FeatureWindowKey(teamId, venue, asOf, window, weighted);
        return formCache.computeIfAbsent(key, this::computeForm);
    }

    public TeamForm form(long teamId, LocalDateTime asOf, int window) {
        return form(teamId, asOf, window, Venue.ALL, true);
    }

    private TeamForm computeForm(FeatureWindowKey key) {
        List<MatchRecord> recent = lastMatches(key.teamId(), key.asOf(), key.window(), key.venue());
        if (recent.isEmpty()) {
            return TeamForm.neutral();
        }

        long team = key.teamId();
        int wins = 0, draws = 0, losses = 0, goalsFor = 0, goalsAgainst = 0, points = 0;
        int cleanSheets = 0, btts = 0, over25 = 0, failedToScore = 0;
        double weightedSum = 0.0;
        double weightTotal = 0.0;

        // recent est ordonné du plus récent au plus ancien
        for (int i = 0; i < recent.size(); i++) {
            MatchRecord m = recent.get(i);
            int gf = m.goalsFor(team);
            int ga = m.goalsAgainst(team);
            int pts = m.pointsFor(team);

            if (gf > ga) wins++;
            else if (gf == ga) draws++;
            else losses++;

            goalsFor += gf;
            goalsAgainst += ga;
            points += pts;
            if (ga == 0) cleanSheets++;
            if (gf == 0) failedToScore++;
            if (gf > 0 && ga > 0) btts++;
            if (gf + ga > 2) over25++;

            double weight = key.weighted() ? Math.pow(params.decay(), i) : 1.0;
            weightedSum += pts * weight;
            weightTotal += weight;
        }

        return new TeamForm(recent.size(), wins, draws, losses, goalsFor, goalsAgainst, points,
                weightedSum / weightTotal, cleanSheets, btts, over25, failedToScore);
    }

    // =================================================================================
    // CONFRONTATIONS DIRECTES
    // =================================================================================

    /** Les {@code window} dernières confrontations A/B avant {@code asOf}, lieu indifférent. */
    public HeadToHead headToHead(long teamA, long teamB, LocalDateTime asOf, int window) {
        requireTeam(teamA);
        requireTeam(teamB);
        if (teamA == teamB) {
            throw new ValidationException("Confrontation d'une équipe avec elle-même : " + teamA);
        }
        requireDate(asOf);
        requireWindow(window);
        return headToHeadCache.computeIfAbsent(new HeadToHeadKey(teamA, teamB, asOf, window), this::computeHeadToHead);
    }

    private HeadToHead computeHeadToHead(HeadToHeadKey key) {
        List<MatchRecord> prior = priorMatches(key.teamA(), key.asOf());
        List<MatchRecord> meetings = new ArrayList<>();
        for (int i = prior.size() - 1; i >= 0 && meetings.size() < key.window(); i--) {
            MatchRecord m = prior.get(i);
            if (m.involves(key.teamB())) {
                meetings.add(m);
            }
        }
        if (meetings.isEmpty()) {
            return HeadToHead.empty(key.teamA(), key.teamB());
        }

        int aWins = 0, draws = 0, bWins = 0, aGoals = 0, bGoals = 0;
        for (MatchRecord m : meetings) {
            int ga = m.goalsFor(key.teamA());
            int gb = m.goalsAgainst(key.teamA());
            aGoals += ga;
            bGoals += gb;
            if (ga > gb) aWins++;
            else if (ga == gb) draws++;
            else bWins++;
        }
        return new HeadToHead(key.teamA(), key.teamB(), meetings.size(), aWins, draws, bWins, aGoals, bGoals);
    }

    // =================================================================================
    // CLASSEMENT
    // =================================================================================

    /**
     * Position au classement (points, différence de buts, buts marqués) avant {@code asOf}.
     * Sans match de ligue joué par l'équipe : milieu de tableau.
     */
    public int leaguePosition(long teamId, long leagueId, LocalDateTime asOf) {
        requireTeam(teamId);
        requireDate(asOf);
        if (!teamsByLeague.containsKey(leagueId)) {
            throw new UnknownEntityException("Ligue", leagueId);
        }
        return positionCache.computeIfAbsent(new PositionKey(teamId, leagueId, asOf), this::computePosition);
    }

    private int computePosition(PositionKey key) {
        List<MatchRecord> prior = before(matchesByLeague.getOrDefault(key.leagueId(), List.of()), key.asOf());
        guardLeakage(prior, key.asOf());

        Map<Long, int[]> table = new HashMap<>(); // [points, goalsFor, goalsAgainst]
        for (MatchRecord m : prior) {
            accumulate(table, m.homeTeamId(), m);
            accumulate(table, m.awayTeamId(), m);
        }
        if (!table.containsKey(key.teamId())) {
            return midTable(key.leagueId());
        }

        List<Standing> standings = new ArrayList<>();
        table.forEach((team, row) -> standings.add(new Standing(team, row[0], row[1] - row[2], row[1])));
        standings.sort(Comparator.comparingInt(Standing::points).reversed()
                .thenComparing(Comparator.comparingInt(Standing::goalDifference).reversed())
                .thenComparing(Comparator.comparingInt(Standing::goalsFor).reversed())
                .thenComparingLong(Standing::teamId));

        for (int i = 0; i < standings.size(); i++) {
            if (standings.get(i).teamId() == key.teamId()) {
                return i + 1;
            }
        }
        return midTable(key.leagueId());
    }

    private void accumulate(Map<Long, int[]> table, long teamId, MatchRecord m) {
        int[] row = table.computeIfAbsent(teamId, id -> new int[3]);
        row[0] += m.pointsFor(teamId);
        row[1] += m.goalsFor(teamId);
        row[2] += m.goalsAgainst(teamId);
    }

    private int midTable(long leagueId) {
        int size = leagueSize(leagueId);
        return (size + 1) / 2;
    }

    public int leagueSize(long leagueId) {
        Set<Long> teams = teamsByLeague.get(leagueId);
        return teams == null || teams.isEmpty() ? params.defaultLeagueSize() : teams.size();
    }

    // =================================================================================
    // REPOS & SÉRIE
    // =================================================================================

    /** Jours depuis le dernier match, plafonnés ; valeur par défaut sans match précédent. */
    public int restDays(long teamId, LocalDateTime asOf) {
        requireTeam(teamId);
        requireDate(asOf);
        List<MatchRecord> prior = priorMatches(teamId, asOf);
        if (prior.isEmpty()) {
            return params.defaultRestDays();
        }
        LocalDateTime last = prior.get(prior.size() - 1).matchDate();
        long days = Duration.between(last, asOf).toDays();
        return (int) Math.min(days, params.maxRestDays());
    }

    /**
     * Série en cours sur les {@code lastN} derniers matchs : +n victoires, -n défaites.
     * Un nul ou un changement de résultat arrête la série.
     */
    public int streak(long teamId, LocalDateTime asOf, int lastN) {
        requireTeam(teamId);
        requireDate(asOf);
        requireWindow(lastN);
        int streak = 0;
        for (MatchRecord m : lastMatches(teamId, asOf, lastN, Venue.ALL)) {
            int diff = m.goalsFor(teamId) - m.goalsAgainst(teamId);
            if (diff > 0 && streak >= 0) streak++;
            else if (diff < 0 && streak <= 0) streak--;
            else break;
        }
        return streak;
    }

    /** Derniers matchs avant {@code asOf}, du plus récent au plus ancien. */
    public List<MatchRecord> lastMatches(long teamId, LocalDateTime asOf, int window, Venue venue) {
        List<MatchRecord> prior = priorMatches(teamId, asOf);
        List<MatchRecord> recent = new ArrayList<>(Math.min(window, prior.size()));
        for (int i = prior.size() - 1; i >= 0 && recent.size() < window; i--) {
            MatchRecord m = prior.get(i);
            if (venue.accepts(m, teamId)) {
                recent.add(m);
            }
        }
        return recent;
    }

    public boolean isKnownTeam(long teamId) {
        return teamLeagues.containsKey(teamId);
    }

    public boolean isKnownLeague(long leagueId) {
        return teamsByLeague.containsKey(leagueId);
    }

    public Long leagueOf(long teamId) {
        return teamLeagues.get(teamId);
    }

    /** Nombre de fenêtres de forme mémoïsées. */
    public int cachedWindowCount() {
        return formCache.size();
    }

    // =================================================================================
    // DÉCOUPAGE TEMPOREL
    // =================================================================================

    private List<MatchRecord> priorMatches(long teamId, LocalDateTime asOf) {
        List<MatchRecord> prior = before(matchesByTeam.getOrDefault(teamId, List.of()), asOf);
        guardLeakage(prior, asOf);
        return prior;
    }

    /** Préfixe de la liste triée dont les matchs sont strictement avant {@code asOf}. */
    static List<MatchRecord> before(List<MatchRecord> sorted, LocalDateTime asOf) {
        int low = 0;
        int high = sorted.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (sorted.get(mid).matchDate().isBefore(asOf)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return sorted.subList(0, low);
    }

    private static void guardLeakage(List<MatchRecord> window, LocalDateTime asOf) {
        if (!window.isEmpty() && !window.get(window.size() - 1).matchDate().isBefore(asOf)) {
            throw new LeakageViolationException("Match " + window.get(window.size() - 1).id()
                    + " daté après la coupure " + asOf);
        }
    }

    private void requireTeam(long teamId) {
        if (teamId <= 0) {
            throw new ValidationException("Identifiant d'équipe invalide : " + teamId);
        }
        if (!teamLeagues.containsKey(teamId)) {
            throw new UnknownEntityException("Équipe", teamId);
        }
    }

    private static void requireDate(LocalDateTime asOf) {
        if (asOf == null) {
            throw new ValidationException("La date de coupure est requise");
        }
    }

    private static void requireWindow(int window) {
        if (window <= 0) {
            throw new ValidationException("La taille de fenêtre doit être positive : " + window);
        }
    }
}
