package com.tony.footValue.repository;

import com.tony.footValue.exception.ValidationException;
import com.tony.footValue.model.MatchStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaMatchHistoryStoreTest {

    @Mock
    private MatchRepository matchRepository;

    @Mock
    private TeamRepository teamRepository;

    @Mock
    private LeagueRepository leagueRepository;

    @InjectMocks
    private JpaMatchHistoryStore store;

    @Test
    @DisplayName("Matchs à venir : seuls les statuts programmés (NS, TBD) sont demandés")
    @SuppressWarnings("unchecked")
    void upcomingMatchesUseScheduledStatuses() {
        LocalDateTime from = LocalDateTime.of(2025, 3, 1, 0, 0);
        LocalDateTime to = from.plusDays(3);
        when(matchRepository.findUpcoming(any(), eq(from), eq(to))).thenReturn(List.of());

        assertThat(store.listUpcomingMatches(from, to)).isEmpty();

        ArgumentCaptor<Collection<MatchStatus>> statuses = ArgumentCaptor.forClass(Collection.class);
        verify(matchRepository).findUpcoming(statuses.capture(), eq(from), eq(to));
        assertThat(statuses.getValue()).containsExactlyInAnyOrder(MatchStatus.NS, MatchStatus.TBD);
    }

    @Test
    void invalidWindowIsRejected() {
        LocalDateTime from = LocalDateTime.of(2025, 3, 1, 0, 0);

        assertThatThrownBy(() -> store.listUpcomingMatches(from, from))
                .isInstanceOf(ValidationException.class);
        verifyNoInteractions(matchRepository);
    }
}
