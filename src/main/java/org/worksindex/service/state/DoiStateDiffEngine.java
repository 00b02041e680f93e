package org.worksindex.service.state;

import org.worksindex.exceptions.InputSchemaException;
import org.worksindex.models.dto.PresentEntry;
import org.worksindex.models.entity.DoiStateRecord;
import org.worksindex.models.enums.DoiState;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns the present {@code (doi, hash)} universe and the persisted history into the
 * state transitions of one run.
 * <p>
 * Per DOI, with {@code L} the most recent history record:
 * <ul>
 *     <li>present, no {@code L}: UPSERT</li>
 *     <li>present, {@code L} is UPSERT with another hash: UPSERT</li>
 *     <li>present, {@code L} is UPSERT with the same hash: nothing</li>
 *     <li>present, {@code L} is DELETE: UPSERT, whatever the hash</li>
 *     <li>absent, {@code L} is UPSERT: DELETE carrying the last known hash</li>
 *     <li>absent otherwise: nothing</li>
 * </ul>
 * "Most recent" is the latest {@code updatedDate}; on equal dates the record appended
 * last (highest sequence) wins.
 */
public final class DoiStateDiffEngine {

    public static final Comparator<DoiStateRecord> MOST_RECENT_FIRST = Comparator
            .<DoiStateRecord, LocalDate>comparing(DoiStateRecord::getUpdatedDate, Comparator.reverseOrder())
            .thenComparing(DoiStateRecord::getSequence, Comparator.<Long>reverseOrder());

    private DoiStateDiffEngine() {
    }

    public static Map<String, String> presentSet(Collection<PresentEntry> entries) {
        if (entries == null) {
            throw new InputSchemaException("Present set is missing");
        }
        Map<String, String> present = new TreeMap<>();
        for (PresentEntry entry : entries) {
            if (entry == null || isBlank(entry.doi()) || isBlank(entry.hash())) {
                throw new InputSchemaException("Present set entry without doi or hash: " + entry);
            }
            String existing = present.putIfAbsent(entry.doi(), entry.hash());
            if (existing != null && !existing.equals(entry.hash())) {
                throw new InputSchemaException("Present set has conflicting hashes for doi " + entry.doi()
                        + ": " + existing + " and " + entry.hash());
            }
        }
        return present;
    }

    public static void validateHistory(Collection<DoiStateRecord> history) {
        for (DoiStateRecord record : history) {
            if (record == null
                    || isBlank(record.getDoi())
                    || isBlank(record.getHash())
                    || record.getState() == null
                    || record.getUpdatedDate() == null
                    || record.getSequence() == null) {
                throw new InputSchemaException("Malformed DOI state history record: " + record);
            }
        }
    }

    public static Map<String, DoiStateRecord> latestPerDoi(Collection<DoiStateRecord> history) {
        List<DoiStateRecord> sorted = new ArrayList<>(history);
        sorted.sort(MOST_RECENT_FIRST);
        Map<String, DoiStateRecord> latest = new TreeMap<>();
        for (DoiStateRecord record : sorted) {
            latest.putIfAbsent(record.getDoi(), record);
        }
        return latest;
    }

    public static DiffResult diff(Map<String, String> present,
                                  Map<String, DoiStateRecord> latest,
                                  LocalDate runDate) {
        Objects.requireNonNull(runDate, "runDate");
        TreeSet<String> dois = new TreeSet<>(present.keySet());
        dois.addAll(latest.keySet());

        List<DoiStateRecord> records = new ArrayList<>();
        int created = 0;
        int changed = 0;
        int resurrected = 0;
        int deleted = 0;
        int unchanged = 0;

        for (String doi : dois) {
            String hash = present.get(doi);
            DoiStateRecord last = latest.get(doi);
            if (hash != null) {
                if (last == null) {
                    created++;
                } else if (last.getState() == DoiState.DELETE) {
                    resurrected++;
                } else if (!last.getHash().equals(hash)) {
                    changed++;
                } else {
                    unchanged++;
                    continue;
                }
                records.add(DoiStateRecord.of(doi, hash, DoiState.UPSERT, runDate));
            } else if (last.getState() == DoiState.UPSERT) {
                deleted++;
                records.add(DoiStateRecord.of(doi, last.getHash(), DoiState.DELETE, runDate));
            }
        }
        return new DiffResult(List.copyOf(records), created, changed, resurrected, deleted, unchanged);
    }

    public static List<DoiStateRecord> recordsBeyondRetention(Collection<DoiStateRecord> history, int maxStates) {
        if (maxStates < 1) {
            throw new IllegalArgumentException("Retention must keep at least one state per DOI, got " + maxStates);
        }
        Map<String, List<DoiStateRecord>> byDoi = new LinkedHashMap<>();
        for (DoiStateRecord record : history) {
            byDoi.computeIfAbsent(record.getDoi(), key -> new ArrayList<>()).add(record);
        }
        List<DoiStateRecord> expired = new ArrayList<>();
        for (List<DoiStateRecord> records : byDoi.values()) {
            if (records.size() <= maxStates) {
                continue;
            }
            records.sort(MOST_RECENT_FIRST);
            expired.addAll(records.subList(maxStates, records.size()));
        }
        return expired;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
