package org.worksindex.models.dto;

import java.util.List;

public record RelationIndexResponse(List<RelationIndexEntry> entries, List<ExtractionReport> reports) {
}
