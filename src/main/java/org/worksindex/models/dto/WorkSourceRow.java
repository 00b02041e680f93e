package org.worksindex.models.dto;

import java.time.LocalDate;
import java.util.List;

public record WorkSourceRow(
        String doi,
        String sourceRecordId,
        String title,
        String abstractText,
        LocalDate publicationDate,
        String publicationVenue,
        List<Author> authors
) {
}
