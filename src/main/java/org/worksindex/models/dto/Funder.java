package org.worksindex.models.dto;

public record Funder(String name, String ror) {
}
