package org.worksindex.service.state;

import lombok.extern.slf4j.Slf4j;
import org.worksindex.exceptions.InputSchemaException;
import org.worksindex.exceptions.RetentionViolationException;
import org.worksindex.models.dto.PresentEntry;
import org.worksindex.models.entity.DoiStateRecord;
import org.worksindex.models.entity.SyncRun;
import org.worksindex.models.enums.DoiState;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class DoiStateSyncService {

    private final SyncRunService syncRunService;
    private final int maxDoiStates;

    public DoiStateSyncService(SyncRunService syncRunService,
                               @Value("${works-index.retention.max-doi-states:2}") int maxDoiStates) {
        if (maxDoiStates < 1) {
            throw new IllegalArgumentException("works-index.retention.max-doi-states must be at least 1, got " + maxDoiStates);
        }
        this.syncRunService = syncRunService;
        this.maxDoiStates = maxDoiStates;
    }

    @Transactional
    public SyncOutcome synchronize(DoiStateLog stateLog, LocalDate runDate, Collection<PresentEntry> present) {
        if (runDate == null) {
            throw new InputSchemaException("Run date is required");
        }
        Map<String, String> presentSet = DoiStateDiffEngine.presentSet(present);

        Optional<SyncRun> previous = syncRunService.findSuccessful(runDate);
        if (previous.isPresent()) {
            List<DoiStateRecord> exported = stateLog.findByUpdatedDateAndState(runDate, DoiState.UPSERT);
            log.info("[doi-state] Run {} was already applied by sync run {}, returning its {} exported records",
                    runDate, previous.get().getSyncRunUid(), exported.size());
            DiffResult nothing = new DiffResult(List.of(), 0, 0, 0, 0, 0);
            return new SyncOutcome(runDate, presentSet.size(), nothing, exported, 0, true);
        }

        SyncRun run = syncRunService.markRunning(runDate);
        try {
            List<DoiStateRecord> history = stateLog.readAll();
            DoiStateDiffEngine.validateHistory(history);
            checkRunDate(stateLog, runDate);
            if (history.isEmpty()) {
                if (syncRunService.hasRecordedStates()) {
                    throw new IllegalStateException("DOI state history is empty but earlier runs recorded states; "
                            + "refusing to treat run " + runDate + " as a first run");
                }
                log.info("[doi-state] First run {}: history is empty, every present DOI is new", runDate);
            }

            Map<String, DoiStateRecord> latest = DoiStateDiffEngine.latestPerDoi(history);
            DiffResult diff = DoiStateDiffEngine.diff(presentSet, latest, runDate);
            log.info("[doi-state] Run {}: present={}, history={} records/{} dois, new={}, changed={}, resurrected={}, deleted={}, unchanged={}",
                    runDate, presentSet.size(), history.size(), latest.size(), diff.created(), diff.changed(),
                    diff.resurrected(), diff.deleted(), diff.unchanged());

            stateLog.append(diff.records());
            int pruned = stateLog.prune(maxDoiStates);
            List<String> exceeding = stateLog.doisExceeding(maxDoiStates);
            if (!exceeding.isEmpty()) {
                throw new RetentionViolationException(maxDoiStates, exceeding);
            }

            List<DoiStateRecord> exported = stateLog.findByUpdatedDateAndState(runDate, DoiState.UPSERT);
            syncRunService.markSuccess(run, presentSet.size(), diff.upserts(), diff.deleted(), pruned);
            log.info("[doi-state] Run {} appended {} records, pruned {}, exporting {} upserts",
                    runDate, diff.records().size(), pruned, exported.size());
            return new SyncOutcome(runDate, presentSet.size(), diff, exported, pruned, false);
        } catch (RuntimeException exception) {
            log.error("[doi-state] Run {} aborted: {}", runDate, exception.getMessage(), exception);
            syncRunService.markFailure(run, exception.getMessage());
            throw exception;
        }
    }

    private void checkRunDate(DoiStateLog stateLog, LocalDate runDate) {
        Optional<LocalDate> latestDate = stateLog.latestUpdatedDate();
        if (latestDate.isPresent() && latestDate.get().isAfter(runDate)) {
            throw new IllegalStateException("Run " + runDate + " is older than the newest recorded state "
                    + latestDate.get());
        }
    }
}
