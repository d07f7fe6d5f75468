package com.tony.footValue.service;

import com.tony.footValue.config.PredictionProperties;
import com.tony.footValue.engine.ModelSnapshot;
import com.tony.footValue.exception.ModelNotReadyException;
import com.tony.footValue.repository.MatchHistoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.tony.footValue.engine.MatchHistoryFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModelSnapshotServiceTest {

    @Mock
    private MatchHistoryStore historyStore;

    private ModelSnapshotService snapshotService;

    @BeforeEach
    void setUp() {
        PredictionProperties properties = new PredictionProperties();
        snapshotService = new ModelSnapshotService(historyStore, new EloRatingService(properties), properties);
    }

    @Test
    void noSnapshotBeforeFirstBuild() {
        assertThat(snapshotService.current()).isEmpty();
        assertThatThrownBy(() -> snapshotService.requireCurrent()).isInstanceOf(ModelNotReadyException.class);
    }

    @Test
    @DisplayName("Rebuild : un seul chargement de l'historique, snapshot publié")
    void rebuildLoadsHistoryOnceAndPublishes() {
        when(historyStore.listFinishedMatches(null, null)).thenReturn(miniLeague());
        when(historyStore.listLeagueIds()).thenReturn(List.of(LEAGUE));
        when(historyStore.listTeams(LEAGUE)).thenReturn(miniLeagueTeams());

        ModelSnapshot snapshot = snapshotService.rebuild();

        assertThat(snapshotService.requireCurrent()).isSameAs(snapshot);
        assertThat(snapshot.matchCount()).isEqualTo(5);
        assertThat(snapshot.featureSchemaVersion()).isEqualTo("v3");
        assertThat(snapshot.elo().trackedTeams()).isEqualTo(4);
        assertThat(snapshot.scoreline().ratedTeams()).isEqualTo(4);
        assertThat(snapshot.stats().isKnownTeam(4L)).isTrue();
        verify(historyStore, times(1)).listFinishedMatches(null, null);
    }

    @Test
    void buildDoesNotReplaceCurrentSnapshot() {
        when(historyStore.listFinishedMatches(null, null)).thenReturn(miniLeague());
        when(historyStore.listFinishedMatches(day(20), null)).thenReturn(miniLeague().subList(0, 3));
        when(historyStore.listLeagueIds()).thenReturn(List.of(LEAGUE));
        when(historyStore.listTeams(LEAGUE)).thenReturn(miniLeagueTeams());
        ModelSnapshot published = snapshotService.rebuild();

        ModelSnapshot backtest = snapshotService.build(day(20));

        assertThat(backtest.matchCount()).isEqualTo(3);
        assertThat(backtest.historyCutoff()).isEqualTo(day(20));
        assertThat(snapshotService.requireCurrent()).isSameAs(published);
    }
}
