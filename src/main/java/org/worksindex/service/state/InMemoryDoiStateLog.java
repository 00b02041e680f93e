package org.worksindex.service.state;

import org.worksindex.models.entity.DoiStateRecord;
import org.worksindex.models.enums.DoiState;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public class InMemoryDoiStateLog implements DoiStateLog {

    private final List<DoiStateRecord> records = new ArrayList<>();
    private long nextSequence = 1;

    public InMemoryDoiStateLog() {
    }

    public InMemoryDoiStateLog(List<DoiStateRecord> history) {
        for (DoiStateRecord record : history) {
            if (record.getSequence() == null) {
                records.add(record.withSequence(nextSequence++));
            } else {
                records.add(record);
                nextSequence = Math.max(nextSequence, record.getSequence() + 1);
            }
        }
    }

    @Override
    public synchronized List<DoiStateRecord> readAll() {
        return List.copyOf(records);
    }

    @Override
    public synchronized List<DoiStateRecord> append(List<DoiStateRecord> toAppend) {
        List<DoiStateRecord> appended = new ArrayList<>(toAppend.size());
        for (DoiStateRecord record : toAppend) {
            DoiStateRecord stored = record.withSequence(nextSequence++);
            records.add(stored);
            appended.add(stored);
        }
        return appended;
    }

    @Override
    public synchronized int prune(int maxStates) {
        List<DoiStateRecord> expired = DoiStateDiffEngine.recordsBeyondRetention(records, maxStates);
        Set<Long> expiredSequences = new HashSet<>();
        for (DoiStateRecord record : expired) {
            expiredSequences.add(record.getSequence());
        }
        records.removeIf(record -> expiredSequences.contains(record.getSequence()));
        return expired.size();
    }

    @Override
    public synchronized List<DoiStateRecord> findByDoi(String doi) {
        return records.stream()
                .filter(record -> Objects.equals(record.getDoi(), doi))
                .sorted(DoiStateDiffEngine.MOST_RECENT_FIRST)
                .toList();
    }

    @Override
    public synchronized List<DoiStateRecord> findByUpdatedDateAndState(LocalDate updatedDate, DoiState state) {
        return records.stream()
                .filter(record -> record.getState() == state && Objects.equals(record.getUpdatedDate(), updatedDate))
                .sorted(Comparator.comparing(DoiStateRecord::getDoi))
                .toList();
    }

    @Override
    public synchronized Optional<LocalDate> latestUpdatedDate() {
        return records.stream()
                .map(DoiStateRecord::getUpdatedDate)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder());
    }

    @Override
    public synchronized List<String> doisExceeding(int maxStates) {
        Map<String, Long> counts = records.stream()
                .collect(Collectors.groupingBy(DoiStateRecord::getDoi, Collectors.counting()));
        return counts.entrySet().stream()
                .filter(entry -> entry.getValue() > maxStates)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
    }
}
