package org.worksindex.service.state;

import org.worksindex.models.entity.DoiStateRecord;

import java.util.List;

public record DiffResult(
        List<DoiStateRecord> records,
        int created,
        int changed,
        int resurrected,
        int deleted,
        int unchanged
) {

    public int upserts() {
        return created + changed + resurrected;
    }
}
