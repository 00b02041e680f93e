package org.worksindex.service.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.worksindex.models.entity.DoiStateRecord;
import org.worksindex.models.enums.DoiState;
import org.worksindex.repository.DoiStateRecordRepository;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaDoiStateLog implements DoiStateLog {

    private final DoiStateRecordRepository doiStateRecordRepository;

    @Override
    public List<DoiStateRecord> readAll() {
        return doiStateRecordRepository.findAll();
    }

    @Override
    public List<DoiStateRecord> append(List<DoiStateRecord> records) {
        if (records.isEmpty()) {
            return List.of();
        }
        return doiStateRecordRepository.saveAll(records);
    }

    @Override
    public int prune(int maxStates) {
        List<DoiStateRecord> expired = DoiStateDiffEngine.recordsBeyondRetention(readAll(), maxStates);
        if (!expired.isEmpty()) {
            doiStateRecordRepository.deleteAllInBatch(expired);
            log.debug("[doi-state] Pruned {} records beyond retention {}", expired.size(), maxStates);
        }
        return expired.size();
    }

    @Override
    public List<DoiStateRecord> findByDoi(String doi) {
        return doiStateRecordRepository.findByDoiOrderByUpdatedDateDescSequenceDesc(doi);
    }

    @Override
    public List<DoiStateRecord> findByUpdatedDateAndState(LocalDate updatedDate, DoiState state) {
        return doiStateRecordRepository.findByUpdatedDateAndStateOrderByDoiAsc(updatedDate, state);
    }

    @Override
    public Optional<LocalDate> latestUpdatedDate() {
        return Optional.ofNullable(doiStateRecordRepository.findLatestUpdatedDate());
    }

    @Override
    public List<String> doisExceeding(int maxStates) {
        return doiStateRecordRepository.findDoisWithMoreStatesThan(maxStates);
    }
}
