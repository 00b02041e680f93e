package org.worksindex.models.dto;

public record WorkTypeRow(String doi, String type) {
}
