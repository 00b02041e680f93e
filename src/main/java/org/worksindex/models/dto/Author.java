package org.worksindex.models.dto;

public record Author(
        String orcid,
        String firstInitial,
        String givenName,
        String middleInitials,
        String middleNames,
        String surname,
        String full
) {
}
