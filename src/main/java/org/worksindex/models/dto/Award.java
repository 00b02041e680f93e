package org.worksindex.models.dto;

public record Award(String awardId) {
}
