package org.worksindex.models.enums;

public enum DoiState {
    UPSERT,
    DELETE
}
