package org.worksindex.service.relations;

import lombok.extern.slf4j.Slf4j;
import org.worksindex.exceptions.InputSchemaException;
import org.worksindex.models.dto.CrossrefRelationRow;
import org.worksindex.models.dto.DataCitationRow;
import org.worksindex.models.dto.DataCiteRelationRow;
import org.worksindex.models.dto.ExtractionReport;
import org.worksindex.models.dto.ExtractionResult;
import org.worksindex.models.dto.RelationCsvFiles;
import org.worksindex.models.dto.RelationEdge;
import org.worksindex.models.dto.RelationIndexEntry;
import org.worksindex.models.dto.RelationIndexResponse;
import org.worksindex.models.dto.RelationTablesRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Slf4j
@Service
public class RelationIndexService {

    static final List<String> CROSSREF_COLUMNS = List.of("work_doi", "relation_id", "relation_type");
    static final List<String> DATACITE_COLUMNS = List.of("doi", "related_identifier", "relation_type");
    static final List<String> DATA_CITATION_COLUMNS = List.of("publication", "dataset");

    private final CsvTableReader csvTableReader;
    private final RelationCsvFiles configuredFiles;

    public RelationIndexService(CsvTableReader csvTableReader,
                                @Value("${works-index.relations.crossref-csv:}") String crossrefCsv,
                                @Value("${works-index.relations.datacite-csv:}") String dataciteCsv,
                                @Value("${works-index.relations.data-citation-corpus-csv:}") String dataCitationCsv) {
        this.csvTableReader = csvTableReader;
        this.configuredFiles = new RelationCsvFiles(toPath(crossrefCsv), toPath(dataciteCsv), toPath(dataCitationCsv));
    }

    public RelationIndexResponse buildIndex(RelationTablesRequest tables) {
        List<ExtractionResult> results = List.of(
                RelationExtractor.extractCrossref(tables.crossref()),
                RelationExtractor.extractDataCite(tables.datacite()),
                RelationExtractor.extractDataCitations(tables.dataCitationCorpus())
        );

        List<RelationEdge> edges = new ArrayList<>();
        List<ExtractionReport> reports = new ArrayList<>();
        for (ExtractionResult result : results) {
            edges.addAll(result.edges());
            reports.add(result.report());
        }
        List<RelationIndexEntry> entries = RelationIndexBuilder.build(edges);
        return new RelationIndexResponse(entries, reports);
    }

    public RelationIndexResponse buildIndex(RelationCsvFiles files) {
        List<CrossrefRelationRow> crossref = readRows(files.crossref(), CROSSREF_COLUMNS,
                row -> new CrossrefRelationRow(row.get("work_doi"), row.get("relation_id"), row.get("relation_type")));
        List<DataCiteRelationRow> datacite = readRows(files.datacite(), DATACITE_COLUMNS,
                row -> new DataCiteRelationRow(row.get("doi"), row.get("related_identifier"), row.get("relation_type")));
        List<DataCitationRow> citations = readRows(files.dataCitationCorpus(), DATA_CITATION_COLUMNS,
                row -> new DataCitationRow(row.get("publication"), row.get("dataset"), row.get("source")));
        log.info("[relations] Loaded CSV tables: crossref={}, datacite={}, data citation corpus={}",
                crossref.size(), datacite.size(), citations.size());
        return buildIndex(new RelationTablesRequest(crossref, datacite, citations));
    }

    public RelationIndexResponse buildIndexFromConfiguredFiles() {
        if (configuredFiles.crossref() == null && configuredFiles.datacite() == null
                && configuredFiles.dataCitationCorpus() == null) {
            throw new InputSchemaException("No relation CSV files are configured");
        }
        return buildIndex(configuredFiles);
    }

    private static Path toPath(String location) {
        return StringUtils.hasText(location) ? Paths.get(location.trim()).toAbsolutePath().normalize() : null;
    }

    private <T> List<T> readRows(Path path, List<String> columns, Function<Map<String, String>, T> mapper) {
        if (path == null) {
            return List.of();
        }
        return csvTableReader.read(path, columns).stream().map(mapper).toList();
    }
}
