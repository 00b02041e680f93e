package org.worksindex.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.worksindex.models.dto.CanonicalWork;
import org.worksindex.models.dto.DoiStateDTO;
import org.worksindex.models.dto.ExportedWork;
import org.worksindex.models.dto.PresentEntry;
import org.worksindex.models.dto.WorksChangeset;
import org.worksindex.models.dto.WorksSnapshotRequest;
import org.worksindex.models.entity.DoiStateRecord;
import org.worksindex.models.enums.WorkSource;
import org.worksindex.service.canonical.CanonicalWorkBuilder;
import org.worksindex.service.canonical.ContentHasher;
import org.worksindex.service.state.ChangesetExporter;
import org.worksindex.service.state.DoiStateLog;
import org.worksindex.service.state.DoiStateSyncService;
import org.worksindex.service.state.SyncOutcome;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorksIndexService {

    private final DoiStateLog doiStateLog;
    private final DoiStateSyncService doiStateSyncService;
    private final ChangesetExporter changesetExporter;

    public WorksChangeset synchronize(LocalDate runDate, WorksSnapshotRequest snapshot) {
        Map<String, CanonicalWork> works = new LinkedHashMap<>();
        for (CanonicalWork work : CanonicalWorkBuilder.build(WorkSource.DATACITE,
                snapshot.dataciteWorks(), snapshot.dataciteSupplemental())) {
            works.put(work.doi(), work);
        }
        // DataCite takes precedence for a DOI listed by both sources
        int overlapping = 0;
        for (CanonicalWork work : CanonicalWorkBuilder.build(WorkSource.OPENALEX,
                snapshot.openalexWorks(), snapshot.openalexSupplemental())) {
            if (works.putIfAbsent(work.doi(), work) != null) {
                overlapping++;
            }
        }
        if (overlapping > 0) {
            log.info("[works] {} OpenAlex works of run {} are also in DataCite and were skipped", overlapping, runDate);
        }

        List<PresentEntry> present = new ArrayList<>(works.size());
        Map<String, ExportedWork> byDoi = new HashMap<>();
        for (CanonicalWork work : works.values()) {
            String hash = ContentHasher.hash(work);
            present.add(new PresentEntry(work.doi(), hash));
            byDoi.put(work.doi(), new ExportedWork(work.doi(), hash, work));
        }

        SyncOutcome outcome = doiStateSyncService.synchronize(doiStateLog, runDate, present);

        List<ExportedWork> exported = new ArrayList<>(outcome.exported().size());
        int missing = 0;
        for (DoiStateRecord record : outcome.exported()) {
            ExportedWork candidate = byDoi.get(record.getDoi());
            if (candidate != null && Objects.equals(candidate.hash(), record.getHash())) {
                exported.add(candidate);
            } else {
                missing++;
            }
        }
        if (missing > 0) {
            log.warn("[works] {} exported states of run {} no longer match the submitted snapshot and were skipped",
                    missing, runDate);
        }

        WorksChangeset changeset = new WorksChangeset(
                runDate,
                outcome.presentCount(),
                outcome.replayed() ? exported.size() : outcome.diff().upserts(),
                outcome.diff().deleted(),
                outcome.diff().unchanged(),
                outcome.replayed(),
                exported
        );
        changesetExporter.export(changeset);
        return changeset;
    }

    public List<DoiStateDTO> history(String doi) {
        return doiStateLog.findByDoi(doi).stream().map(DoiStateDTO::from).toList();
    }
}
