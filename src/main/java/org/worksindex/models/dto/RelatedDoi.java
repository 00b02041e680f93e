package org.worksindex.models.dto;

public record RelatedDoi(String doi) {
}
