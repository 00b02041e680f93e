package org.worksindex.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.worksindex.models.dto.IdentifierMapping;
import org.worksindex.models.dto.RegistryOrganization;
import org.worksindex.models.dto.RelationIndexResponse;
import org.worksindex.models.dto.RelationTablesRequest;
import org.worksindex.service.identifiers.IdentifierNormalizer;
import org.worksindex.service.relations.RelationIndexService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RelationIndexController {

    private final RelationIndexService relationIndexService;

    @PostMapping("/relations/index")
    public ResponseEntity<RelationIndexResponse> buildRelationIndex(@RequestBody RelationTablesRequest tables) {
        log.info("Building relation index: crossref={}, datacite={}, data citation corpus={}",
                tables.crossref().size(), tables.datacite().size(), tables.dataCitationCorpus().size());
        return ResponseEntity.ok(relationIndexService.buildIndex(tables));
    }

    @PostMapping("/relations/index/csv")
    public ResponseEntity<RelationIndexResponse> buildRelationIndexFromCsv() {
        log.info("Building relation index from configured CSV exports");
        return ResponseEntity.ok(relationIndexService.buildIndexFromConfiguredFiles());
    }

    @PostMapping("/identifiers/registry-index")
    public ResponseEntity<List<IdentifierMapping>> buildRegistryIndex(@RequestBody List<RegistryOrganization> organizations) {
        return ResponseEntity.ok(IdentifierNormalizer.buildRegistryIndex(organizations));
    }
}
