package org.worksindex.service.state;

import org.worksindex.models.entity.DoiStateRecord;

import java.time.LocalDate;
import java.util.List;

public record SyncOutcome(
        LocalDate runDate,
        int presentCount,
        DiffResult diff,
        List<DoiStateRecord> exported,
        int pruned,
        boolean replayed
) {
}
