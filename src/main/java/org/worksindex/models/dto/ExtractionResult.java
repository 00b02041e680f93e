package org.worksindex.models.dto;

import java.util.List;

public record ExtractionResult(List<RelationEdge> edges, ExtractionReport report) {
}
