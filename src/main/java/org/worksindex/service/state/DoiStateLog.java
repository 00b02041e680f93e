package org.worksindex.service.state;

import org.worksindex.models.entity.DoiStateRecord;
import org.worksindex.models.enums.DoiState;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface DoiStateLog {

    List<DoiStateRecord> readAll();

    List<DoiStateRecord> append(List<DoiStateRecord> records);

    int prune(int maxStates);

    List<DoiStateRecord> findByDoi(String doi);

    List<DoiStateRecord> findByUpdatedDateAndState(LocalDate updatedDate, DoiState state);

    Optional<LocalDate> latestUpdatedDate();

    List<String> doisExceeding(int maxStates);
}
