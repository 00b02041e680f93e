package org.worksindex.controllers;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.worksindex.models.dto.DoiStateDTO;
import org.worksindex.models.dto.WorksChangeset;
import org.worksindex.models.dto.WorksSnapshotRequest;
import org.worksindex.service.WorksIndexService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/works")
@RequiredArgsConstructor
public class WorksIndexController {

    private final WorksIndexService worksIndexService;

    @PostMapping("/sync/{runDate}")
    public ResponseEntity<WorksChangeset> synchronize(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate runDate,
            @RequestBody WorksSnapshotRequest snapshot) {
        log.info("Received works snapshot for run {}: datacite={}, openalex={}",
                runDate, snapshot.dataciteWorks().size(), snapshot.openalexWorks().size());
        return ResponseEntity.ok(worksIndexService.synchronize(runDate, snapshot));
    }

    @GetMapping("/doi-state")
    public ResponseEntity<List<DoiStateDTO>> history(@RequestParam String doi) {
        return ResponseEntity.ok(worksIndexService.history(doi));
    }
}
