package org.worksindex.models.enums;

public enum RelationSource {
    CROSSREF_METADATA,
    DATACITE,
    DATA_CITATION_CORPUS
}
