package org.worksindex.models.dto;

import org.worksindex.models.enums.WorkType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record CanonicalWork(
        String doi,
        String title,
        String abstractText,
        WorkType workType,
        LocalDate publicationDate,
        Instant updatedDate,
        String publicationVenue,
        List<Institution> institutions,
        List<Author> authors,
        List<Funder> funders,
        List<Award> awards,
        SourceInfo source
) {
    public CanonicalWork {
        workType = workType == null ? WorkType.FALLBACK : workType;
        institutions = institutions == null ? List.of() : List.copyOf(institutions);
        authors = authors == null ? List.of() : List.copyOf(authors);
        funders = funders == null ? List.of() : List.copyOf(funders);
        awards = awards == null ? List.of() : List.copyOf(awards);
    }
}
