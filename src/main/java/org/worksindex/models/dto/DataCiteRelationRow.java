package org.worksindex.models.dto;

public record DataCiteRelationRow(String doi, String relatedIdentifier, String relationType) {
}
