package org.worksindex.models.dto;

import org.worksindex.models.enums.RelationSource;

public record ExtractionReport(
        RelationSource source,
        int rowsRead,
        int edges,
        int droppedUnresolved,
        int droppedSelfLoops
) {

    public int dropped() {
        return droppedUnresolved + droppedSelfLoops;
    }
}
