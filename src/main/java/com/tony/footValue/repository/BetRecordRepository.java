package com.tony.footValue.repository;

import com.tony.footValue.model.BetRecord;
import com.tony.footValue.model.BetStatus;
import com.tony.footValue.model.MatchStatus;
import com.tony.footValue.model.ValueTier;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface BetRecordRepository extends JpaRepository<BetRecord, Long> {

    // Paris en attente dont le match est terminé : candidats au règlement
    @Query("SELECT b FROM BetRecord b JOIN FETCH b.match m " +
            "WHERE b.status = :pending AND m.status = :finished ORDER BY b.placedAt ASC")
    List<BetRecord> findSettleable(@Param("pending") BetStatus pending,
                                   @Param("finished") MatchStatus finished);

    List<BetRecord> findByStatusIn(Collection<BetStatus> statuses);

    List<BetRecord> findByStatusInAndSettledAtIsNotNullOrderBySettledAtAscIdAsc(Collection<BetStatus> statuses);

    long countByStatus(BetStatus status);

    @Query("SELECT b FROM BetRecord b WHERE " +
            "(:tier IS NULL OR b.valueTier = :tier) AND (:status IS NULL OR b.status = :status) " +
            "ORDER BY b.placedAt DESC")
    List<BetRecord> findHistory(@Param("tier") ValueTier tier,
                                @Param("status") BetStatus status,
                                Pageable pageable);
}
