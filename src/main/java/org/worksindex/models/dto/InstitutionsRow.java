package org.worksindex.models.dto;

import java.util.List;

public record InstitutionsRow(String doi, List<Institution> institutions) {
}
