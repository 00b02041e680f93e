package org.worksindex.models.dto;

public record DataCitationRow(String publication, String dataset, String source) {
}
