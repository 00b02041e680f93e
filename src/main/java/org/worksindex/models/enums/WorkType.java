package org.worksindex.models.enums;

import java.util.Locale;

public enum WorkType {
    ARTICLE,
    AUDIOVISUAL,
    BOOK,
    BOOK_CHAPTER,
    COLLECTION,
    COMPUTATIONAL_NOTEBOOK,
    CONFERENCE_PAPER,
    CONFERENCE_PROCEEDING,
    DATA_PAPER,
    DATASET,
    DISSERTATION,
    EDITORIAL,
    ERRATUM,
    EVENT,
    GRANT,
    IMAGE,
    INSTRUMENT,
    INTERACTIVE_RESOURCE,
    JOURNAL,
    JOURNAL_ARTICLE,
    LETTER,
    MODEL,
    OUTPUT_MANAGEMENT_PLAN,
    PARATEXT,
    PEER_REVIEW,
    PHYSICAL_OBJECT,
    PREPRINT,
    PROJECT,
    REFERENCE_ENTRY,
    REPORT,
    RETRACTION,
    REVIEW,
    SERVICE,
    SOFTWARE,
    SOUND,
    STANDARD,
    STUDY_REGISTRATION,
    SUPPLEMENTARY_MATERIALS,
    TEXT,
    WORKFLOW,
    OTHER;

    public static final WorkType FALLBACK = OTHER;

    public static WorkType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FALLBACK;
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replaceAll("[\\s\\-]+", "_")
                .toUpperCase(Locale.ROOT);
        for (WorkType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return FALLBACK;
    }
}
