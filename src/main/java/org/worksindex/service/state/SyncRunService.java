package org.worksindex.service.state;

import lombok.RequiredArgsConstructor;
import org.worksindex.models.entity.SyncRun;
import org.worksindex.models.enums.RunStatus;
import org.worksindex.repository.SyncRunRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class SyncRunService {

    private final SyncRunRepository syncRunRepository;

    // running and failed markers survive a rollback of the run; success commits with it
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SyncRun markRunning(LocalDate runDate) {
        SyncRun run = new SyncRun();
        run.setSyncRunUid(UUID.randomUUID().toString());
        run.setRunDate(runDate);
        run.setRunStatus(RunStatus.RUNNING);
        run.setStartedAt(Instant.now());
        return syncRunRepository.save(run);
    }

    @Transactional
    public SyncRun markSuccess(SyncRun run, int rowsIn, int upserts, int deletes, int pruned) {
        run.setRunStatus(RunStatus.SUCCESS);
        run.setRowsIn(rowsIn);
        run.setUpserts(upserts);
        run.setDeletes(deletes);
        run.setPruned(pruned);
        run.setEndedAt(Instant.now());
        run.setErrorMessage(null);
        return syncRunRepository.save(run);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public SyncRun markFailure(SyncRun run, String message) {
        run.setRunStatus(RunStatus.FAILED);
        run.setEndedAt(Instant.now());
        run.setErrorMessage(message);
        return syncRunRepository.save(run);
    }

    @Transactional(readOnly = true)
    public Optional<SyncRun> findSuccessful(LocalDate runDate) {
        return syncRunRepository.findFirstByRunDateAndRunStatusOrderByStartedAtDesc(runDate, RunStatus.SUCCESS);
    }

    @Transactional(readOnly = true)
    public boolean hasRecordedStates() {
        return syncRunRepository.existsByRunStatusAndUpsertsGreaterThan(RunStatus.SUCCESS, 0);
    }
}
