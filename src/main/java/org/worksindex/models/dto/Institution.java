package org.worksindex.models.dto;

public record Institution(String name, String ror) {
}
