package com.tony.footValue.model;

import com.tony.footValue.engine.TeamRecord;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(uniqueConstraints = {
        @UniqueConstraint(columnNames = {"name", "league_id"})
})
public class Team {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String code; // Ex: "PSG", "OM"

    @ManyToOne
    @JoinColumn(name = "league_id")
    private League league;

    public Team(String name, League league) {
        this.name = name;
        this.league = league;
    }

    public TeamRecord toRecord() {
        return new TeamRecord(id, league != null ? league.getId() : null, name);
    }

    // HashCode compatible JPA (évite les bugs quand l'ID change après save)
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return id != null && id.equals(((Team) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
