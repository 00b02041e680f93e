package org.worksindex.service.state;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.worksindex.exceptions.InputSchemaException;
import org.worksindex.models.dto.PresentEntry;
import org.worksindex.models.entity.DoiStateRecord;
import org.worksindex.models.entity.SyncRun;
import org.worksindex.models.enums.DoiState;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DoiStateSyncServiceTest {

    private static final LocalDate JAN = LocalDate.of(2024, 1, 1);
    private static final LocalDate FEB = LocalDate.of(2024, 2, 1);
    private static final LocalDate MAR = LocalDate.of(2024, 3, 1);

    private SyncRunService syncRunService;
    private DoiStateSyncService service;

    @BeforeEach
    void setUp() {
        syncRunService = mock(SyncRunService.class);
        when(syncRunService.markRunning(any())).thenAnswer(invocation -> {
            SyncRun run = new SyncRun();
            run.setRunDate(invocation.getArgument(0));
            return run;
        });
        when(syncRunService.findSuccessful(any())).thenReturn(Optional.empty());
        service = new DoiStateSyncService(syncRunService, 2);
    }

    private static InMemoryDoiStateLog history(DoiStateRecord... records) {
        return new InMemoryDoiStateLog(List.of(records));
    }

    @Test
    void deletionIsRecordedButNotExported() {
        InMemoryDoiStateLog stateLog = history(DoiStateRecord.of("A", "h1", DoiState.UPSERT, JAN));

        SyncOutcome outcome = service.synchronize(stateLog, FEB, List.of());

        assertThat(outcome.diff().records())
                .extracting(DoiStateRecord::getDoi, DoiStateRecord::getHash, DoiStateRecord::getState, DoiStateRecord::getUpdatedDate)
                .containsExactly(tuple("A", "h1", DoiState.DELETE, FEB));
        assertThat(outcome.exported()).isEmpty();
        assertThat(stateLog.findByDoi("A")).extracting(DoiStateRecord::getState)
                .containsExactly(DoiState.DELETE, DoiState.UPSERT);
    }

    @Test
    void resurrectionUpsertsDespiteUnchangedHash() {
        InMemoryDoiStateLog stateLog = history(DoiStateRecord.of("A", "h1", DoiState.DELETE, FEB));

        SyncOutcome outcome = service.synchronize(stateLog, MAR, List.of(new PresentEntry("A", "h1")));

        assertThat(outcome.exported())
                .extracting(DoiStateRecord::getDoi, DoiStateRecord::getHash, DoiStateRecord::getState, DoiStateRecord::getUpdatedDate)
                .containsExactly(tuple("A", "h1", DoiState.UPSERT, MAR));
        assertThat(outcome.diff().resurrected()).isEqualTo(1);
    }

    @Test
    void unchangedDoiEmitsNothing() {
        InMemoryDoiStateLog stateLog = history(DoiStateRecord.of("A", "h1", DoiState.UPSERT, JAN));

        SyncOutcome outcome = service.synchronize(stateLog, FEB, List.of(new PresentEntry("A", "h1")));

        assertThat(outcome.diff().records()).isEmpty();
        assertThat(outcome.exported()).isEmpty();
        assertThat(stateLog.readAll()).hasSize(1);
    }

    @Test
    void firstRunUpsertsEverythingPresent() {
        InMemoryDoiStateLog stateLog = new InMemoryDoiStateLog();

        SyncOutcome outcome = service.synchronize(stateLog, JAN,
                List.of(new PresentEntry("B", "h2"), new PresentEntry("A", "h1"), new PresentEntry("A", "h1")));

        assertThat(outcome.presentCount()).isEqualTo(2);
        assertThat(outcome.exported()).extracting(DoiStateRecord::getDoi).containsExactly("A", "B");
        verify(syncRunService).markSuccess(any(), eq(2), eq(2), eq(0), eq(0));
    }

    @Test
    void emptyHistoryAfterRecordedRunsAbortsTheRun() {
        when(syncRunService.hasRecordedStates()).thenReturn(true);
        InMemoryDoiStateLog stateLog = new InMemoryDoiStateLog();

        assertThatThrownBy(() -> service.synchronize(stateLog, FEB, List.of(new PresentEntry("A", "h1"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("history is empty");
        assertThat(stateLog.readAll()).isEmpty();
        verify(syncRunService).markFailure(any(), anyString());
    }

    @Test
    void retentionIsAppliedAfterAppending() {
        InMemoryDoiStateLog stateLog = history(
                DoiStateRecord.of("A", "h1", DoiState.UPSERT, JAN),
                DoiStateRecord.of("A", "h2", DoiState.UPSERT, FEB));

        SyncOutcome outcome = service.synchronize(stateLog, MAR, List.of(new PresentEntry("A", "h3")));

        assertThat(outcome.pruned()).isEqualTo(1);
        assertThat(stateLog.findByDoi("A"))
                .extracting(DoiStateRecord::getHash, DoiStateRecord::getUpdatedDate)
                .containsExactly(tuple("h3", MAR), tuple("h2", FEB));
    }

    @Test
    void malformedPresentSetAbortsBeforeAnyAppend() {
        InMemoryDoiStateLog stateLog = history(DoiStateRecord.of("A", "h1", DoiState.UPSERT, JAN));

        assertThatThrownBy(() -> service.synchronize(stateLog, FEB,
                List.of(new PresentEntry("B", "h1"), new PresentEntry("B", "h2"))))
                .isInstanceOf(InputSchemaException.class);

        assertThat(stateLog.readAll()).hasSize(1);
        verify(syncRunService, never()).markRunning(any());
    }

    @Test
    void malformedHistoryAbortsBeforeAnyAppend() {
        DoiStateLog stateLog = mock(DoiStateLog.class);
        when(stateLog.readAll()).thenReturn(List.of(new DoiStateRecord(1L, "A", "h1", null, JAN)));

        assertThatThrownBy(() -> service.synchronize(stateLog, FEB, List.of(new PresentEntry("A", "h1"))))
                .isInstanceOf(InputSchemaException.class);

        verify(stateLog, never()).append(any());
        verify(stateLog, never()).prune(anyInt());
    }

    @Test
    void runOlderThanHistoryIsRejected() {
        InMemoryDoiStateLog stateLog = history(DoiStateRecord.of("A", "h1", DoiState.UPSERT, MAR));

        assertThatThrownBy(() -> service.synchronize(stateLog, FEB, List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("older than");
        assertThat(stateLog.readAll()).hasSize(1);
    }

    @Test
    void replayingAnAppliedRunReturnsItsChangesetWithoutAppending() {
        InMemoryDoiStateLog stateLog = new InMemoryDoiStateLog();
        List<PresentEntry> present = List.of(new PresentEntry("A", "h1"));
        SyncOutcome first = service.synchronize(stateLog, JAN, present);

        SyncRun applied = new SyncRun();
        applied.setSyncRunUid("run-1");
        when(syncRunService.findSuccessful(JAN)).thenReturn(Optional.of(applied));
        SyncOutcome replay = service.synchronize(stateLog, JAN, present);

        assertThat(replay.replayed()).isTrue();
        assertThat(replay.exported()).extracting(DoiStateRecord::getDoi).isEqualTo(
                first.exported().stream().map(DoiStateRecord::getDoi).toList());
        assertThat(stateLog.readAll()).hasSize(1);
    }

    @Test
    void reapplyingTheSameRunAfterFailureDoesNotDoubleAppend() {
        InMemoryDoiStateLog stateLog = history(DoiStateRecord.of("A", "h1", DoiState.UPSERT, JAN));
        List<PresentEntry> present = List.of(new PresentEntry("A", "h2"), new PresentEntry("B", "h1"));

        service.synchronize(stateLog, FEB, present);
        SyncOutcome again = service.synchronize(stateLog, FEB, present);

        assertThat(again.diff().records()).isEmpty();
        assertThat(again.exported()).extracting(DoiStateRecord::getDoi).containsExactly("A", "B");
        assertThat(stateLog.readAll()).hasSize(3);
    }

    @Test
    void missingRunDateIsRejected() {
        assertThatThrownBy(() -> service.synchronize(new InMemoryDoiStateLog(), null, List.of()))
                .isInstanceOf(InputSchemaException.class);
    }

    @Test
    void retentionBoundMustBePositive() {
        assertThatThrownBy(() -> new DoiStateSyncService(syncRunService, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
