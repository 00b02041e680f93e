package org.worksindex.models.dto;

public record IdentifierMapping(String rorId, String type, String identifier) {
}
