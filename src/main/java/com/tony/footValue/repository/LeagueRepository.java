package com.tony.footValue.repository;

import com.tony.footValue.model.League;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface LeagueRepository extends JpaRepository<League, Long> {
    @Query("SELECT l.id FROM League l ORDER BY l.id")
    List<Long> findAllIds();
}
