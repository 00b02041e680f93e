package org.worksindex.models.dto;

import java.util.List;

public record AwardsRow(String doi, List<Award> awards) {
}
