package org.worksindex.service.relations;

import lombok.extern.slf4j.Slf4j;
import org.worksindex.models.dto.CrossrefRelationRow;
import org.worksindex.models.dto.DataCitationRow;
import org.worksindex.models.dto.DataCiteRelationRow;
import org.worksindex.models.dto.ExtractionReport;
import org.worksindex.models.dto.ExtractionResult;
import org.worksindex.models.dto.RelationEdge;
import org.worksindex.models.enums.RelationSource;
import org.worksindex.service.identifiers.DoiExtractor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

@Slf4j
public final class RelationExtractor {

    private RelationExtractor() {
    }

    public static ExtractionResult extractCrossref(List<CrossrefRelationRow> rows) {
        return extract(RelationSource.CROSSREF_METADATA, rows,
                CrossrefRelationRow::workDoi,
                CrossrefRelationRow::relationId,
                CrossrefRelationRow::relationType,
                RelationVocabulary.CROSSREF);
    }

    public static ExtractionResult extractDataCite(List<DataCiteRelationRow> rows) {
        return extract(RelationSource.DATACITE, rows,
                DataCiteRelationRow::doi,
                DataCiteRelationRow::relatedIdentifier,
                DataCiteRelationRow::relationType,
                RelationVocabulary.DATACITE);
    }

    // no relation type: every kept row is a dataset relation
    public static ExtractionResult extractDataCitations(List<DataCitationRow> rows) {
        return extract(RelationSource.DATA_CITATION_CORPUS, rows,
                DataCitationRow::publication,
                DataCitationRow::dataset,
                row -> null,
                null);
    }

    private static <T> ExtractionResult extract(RelationSource source,
                                                List<T> rows,
                                                Function<T, String> from,
                                                Function<T, String> to,
                                                Function<T, String> relationType,
                                                RelationVocabulary vocabulary) {
        if (rows == null || rows.isEmpty()) {
            return new ExtractionResult(List.of(), new ExtractionReport(source, 0, 0, 0, 0));
        }
        Set<RelationEdge> edges = new LinkedHashSet<>();
        int unresolved = 0;
        int selfLoops = 0;
        for (T row : rows) {
            String workDoi = row == null ? null : DoiExtractor.extract(from.apply(row));
            String relatedDoi = row == null ? null : DoiExtractor.extract(to.apply(row));
            if (workDoi == null || relatedDoi == null) {
                unresolved++;
                continue;
            }
            if (workDoi.equals(relatedDoi)) {
                selfLoops++;
                continue;
            }
            String type = relationType.apply(row);
            if (vocabulary == null) {
                edges.add(new RelationEdge(workDoi, relatedDoi, type, false, false, true));
            } else {
                RelationVocabulary.RelationCategories categories = vocabulary.classify(type);
                edges.add(new RelationEdge(workDoi, relatedDoi, type,
                        categories.intraWork(), categories.possibleSharedProject(), false));
            }
        }
        ExtractionReport report = new ExtractionReport(source, rows.size(), edges.size(), unresolved, selfLoops);
        log.info("[relations] {}: read={}, edges={}, dropped without doi={}, dropped self-loops={}",
                source, report.rowsRead(), report.edges(), unresolved, selfLoops);
        return new ExtractionResult(new ArrayList<>(edges), report);
    }
}
