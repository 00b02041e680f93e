package org.worksindex.models.dto;

import java.util.List;

public record RelationIndexEntry(
        String doi,
        List<RelatedDoi> intraWorkDois,
        List<RelatedDoi> possibleSharedProjectDois,
        List<RelatedDoi> datasetCitationDois
) {
}
