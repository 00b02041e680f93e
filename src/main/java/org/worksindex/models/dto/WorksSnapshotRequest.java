package org.worksindex.models.dto;

import java.util.List;

public record WorksSnapshotRequest(
        List<WorkSourceRow> dataciteWorks,
        SupplementalTables dataciteSupplemental,
        List<WorkSourceRow> openalexWorks,
        SupplementalTables openalexSupplemental
) {
    public WorksSnapshotRequest {
        dataciteWorks = dataciteWorks == null ? List.of() : dataciteWorks;
        dataciteSupplemental = dataciteSupplemental == null ? SupplementalTables.empty() : dataciteSupplemental;
        openalexWorks = openalexWorks == null ? List.of() : openalexWorks;
        openalexSupplemental = openalexSupplemental == null ? SupplementalTables.empty() : openalexSupplemental;
    }
}
