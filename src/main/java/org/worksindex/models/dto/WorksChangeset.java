package org.worksindex.models.dto;

import java.time.LocalDate;
import java.util.List;

public record WorksChangeset(
        LocalDate runDate,
        int presentCount,
        int upserts,
        int deletes,
        int unchanged,
        boolean replayed,
        List<ExportedWork> works
) {
}
