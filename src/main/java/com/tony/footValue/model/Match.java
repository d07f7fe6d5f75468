package com.tony.footValue.model;

import com.tony.footValue.engine.MatchRecord;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Match tel que fourni par le Match History Store.
 * Le moteur ne le lit qu'à travers sa projection immuable {@link MatchRecord}.
 */
@Entity
@Table(name = "matches", indexes = {
        @Index(name = "idx_match_date", columnList = "matchDate"),
        @Index(name = "idx_match_status", columnList = "status")
})
@Getter @Setter @NoArgsConstructor
public class Match {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "league_id")
    private League league;

    @ManyToOne(optional = false)
    @JoinColumn(name = "home_team_id")
    private Team homeTeam;

    @ManyToOne(optional = false)
    @JoinColumn(name = "away_team_id")
    private Team awayTeam;

    @Column(nullable = false)
    private LocalDateTime matchDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private MatchStatus status = MatchStatus.NS;

    private Integer round; // journée de championnat

    // Score final (null tant que le match n'est pas joué)
    private Integer homeGoals;
    private Integer awayGoals;

    public boolean isFinished() {
        return status != null && status.isFinished() && homeGoals != null && awayGoals != null;
    }

    public MatchRecord toRecord() {
        return new MatchRecord(id, league.getId(), homeTeam.getId(), awayTeam.getId(), matchDate, status,
                homeGoals, awayGoals, round);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Match)) return false;
        return id != null && id.equals(((Match) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
