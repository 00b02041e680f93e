package org.worksindex.service.canonical;

import lombok.extern.slf4j.Slf4j;
import org.worksindex.exceptions.InputSchemaException;
import org.worksindex.models.dto.AwardsRow;
import org.worksindex.models.dto.CanonicalWork;
import org.worksindex.models.dto.FundersRow;
import org.worksindex.models.dto.InstitutionsRow;
import org.worksindex.models.dto.SupplementalTables;
import org.worksindex.models.dto.UpdatedDateRow;
import org.worksindex.models.dto.WorkSourceRow;
import org.worksindex.models.dto.WorkTypeRow;
import org.worksindex.models.enums.WorkSource;
import org.worksindex.models.enums.WorkType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

@Slf4j
public final class CanonicalWorkBuilder {

    private CanonicalWorkBuilder() {
    }

    public static List<CanonicalWork> build(WorkSource source,
                                            List<WorkSourceRow> primary,
                                            SupplementalTables supplemental) {
        if (source == null) {
            throw new InputSchemaException("Work source is required");
        }
        if (primary == null) {
            throw new InputSchemaException(source.getDisplayName() + " works table is missing");
        }
        SupplementalTables tables = supplemental == null ? SupplementalTables.empty() : supplemental;

        Map<String, WorkTypeRow> types = index(source, "types", tables.types(), WorkTypeRow::doi);
        Map<String, UpdatedDateRow> updatedDates = index(source, "updated_dates", tables.updatedDates(), UpdatedDateRow::doi);
        Map<String, InstitutionsRow> institutions = index(source, "institutions", tables.institutions(), InstitutionsRow::doi);
        Map<String, FundersRow> funders = index(source, "funders", tables.funders(), FundersRow::doi);
        Map<String, AwardsRow> awards = index(source, "awards", tables.awards(), AwardsRow::doi);

        List<CanonicalWork> works = new ArrayList<>(primary.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < primary.size(); i++) {
            WorkSourceRow row = primary.get(i);
            String doi = requireKey(source, "works", i, row == null ? null : row.doi());
            if (!seen.add(doi)) {
                throw new InputSchemaException(source.getDisplayName() + " works table has duplicate doi: " + doi);
            }

            WorkTypeRow type = types.get(doi);
            UpdatedDateRow updated = updatedDates.get(doi);
            InstitutionsRow institutionsRow = institutions.get(doi);
            FundersRow fundersRow = funders.get(doi);
            AwardsRow awardsRow = awards.get(doi);

            works.add(new CanonicalWork(
                    doi,
                    row.title(),
                    row.abstractText(),
                    type == null ? WorkType.FALLBACK : WorkType.fromValue(type.type()),
                    row.publicationDate(),
                    updated == null ? null : updated.updatedDate(),
                    row.publicationVenue(),
                    institutionsRow == null ? List.of() : institutionsRow.institutions(),
                    row.authors(),
                    fundersRow == null ? List.of() : fundersRow.funders(),
                    awardsRow == null ? List.of() : awardsRow.awards(),
                    source.sourceInfo(doi, row.sourceRecordId())
            ));
        }

        log.info("[canonical] Built {} {} works (types={}, updated_dates={}, institutions={}, funders={}, awards={})",
                works.size(), source.getDisplayName(), types.size(), updatedDates.size(), institutions.size(),
                funders.size(), awards.size());
        return works;
    }

    private static <T> Map<String, T> index(WorkSource source,
                                            String table,
                                            List<T> rows,
                                            Function<T, String> key) {
        Map<String, T> indexed = new HashMap<>();
        if (rows == null) {
            return indexed;
        }
        for (int i = 0; i < rows.size(); i++) {
            T row = rows.get(i);
            String doi = requireKey(source, table, i, row == null ? null : key.apply(row));
            if (indexed.putIfAbsent(doi, row) != null) {
                throw new InputSchemaException(source.getDisplayName() + " " + table + " table has duplicate doi: " + doi);
            }
        }
        return indexed;
    }

    private static String requireKey(WorkSource source, String table, int rowIndex, String doi) {
        if (doi == null || doi.isBlank()) {
            throw new InputSchemaException(source.getDisplayName() + " " + table + " row " + rowIndex + " has no doi");
        }
        return doi;
    }
}
