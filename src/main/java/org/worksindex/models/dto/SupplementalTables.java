package org.worksindex.models.dto;

import java.util.List;

public record SupplementalTables(
        List<WorkTypeRow> types,
        List<UpdatedDateRow> updatedDates,
        List<InstitutionsRow> institutions,
        List<FundersRow> funders,
        List<AwardsRow> awards
) {
    public SupplementalTables {
        types = types == null ? List.of() : types;
        updatedDates = updatedDates == null ? List.of() : updatedDates;
        institutions = institutions == null ? List.of() : institutions;
        funders = funders == null ? List.of() : funders;
        awards = awards == null ? List.of() : awards;
    }

    public static SupplementalTables empty() {
        return new SupplementalTables(null, null, null, null, null);
    }
}
