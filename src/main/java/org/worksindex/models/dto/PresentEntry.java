package org.worksindex.models.dto;

public record PresentEntry(String doi, String hash) {
}
