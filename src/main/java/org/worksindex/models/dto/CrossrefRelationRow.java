package org.worksindex.models.dto;

public record CrossrefRelationRow(String workDoi, String relationId, String relationType) {
}
