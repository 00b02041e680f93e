package org.worksindex.models.dto;

public record SourceInfo(String name, String url) {
}
