package org.worksindex.models.dto;

import java.time.Instant;

public record UpdatedDateRow(String doi, Instant updatedDate) {
}
