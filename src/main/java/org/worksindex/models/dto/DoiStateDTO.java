package org.worksindex.models.dto;

import org.worksindex.models.entity.DoiStateRecord;
import org.worksindex.models.enums.DoiState;

import java.time.LocalDate;

public record DoiStateDTO(String doi, String hash, DoiState state, LocalDate updatedDate) {

    public static DoiStateDTO from(DoiStateRecord record) {
        return new DoiStateDTO(record.getDoi(), record.getHash(), record.getState(), record.getUpdatedDate());
    }
}
