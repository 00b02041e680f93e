package org.worksindex.models.dto;

import java.util.List;

public record FundersRow(String doi, List<Funder> funders) {
}
