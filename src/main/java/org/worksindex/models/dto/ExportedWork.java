package org.worksindex.models.dto;

public record ExportedWork(String doi, String hash, CanonicalWork work) {
}
