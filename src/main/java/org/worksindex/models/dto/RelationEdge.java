package org.worksindex.models.dto;

public record RelationEdge(
        String workDoi,
        String relatedDoi,
        String relationType,
        boolean intraWork,
        boolean possibleSharedProject,
        boolean datasetRelation
) {

    public RelationEdge reversed() {
        return new RelationEdge(relatedDoi, workDoi, relationType, intraWork, possibleSharedProject, datasetRelation);
    }

    public boolean hasCategory() {
        return intraWork || possibleSharedProject || datasetRelation;
    }
}
