package org.worksindex.models.enums;

import org.worksindex.models.dto.SourceInfo;

public enum WorkSource {
    DATACITE("DataCite", "https://commons.datacite.org/doi.org/"),
    OPENALEX("OpenAlex", "https://openalex.org/");

    private final String displayName;
    private final String urlPrefix;

    WorkSource(String displayName, String urlPrefix) {
        this.displayName = displayName;
        this.urlPrefix = urlPrefix;
    }

    public String getDisplayName() {
        return displayName;
    }

    public SourceInfo sourceInfo(String doi, String sourceRecordId) {
        String key = this == DATACITE ? doi : sourceRecordId;
        return new SourceInfo(displayName, key == null ? null : urlPrefix + key);
    }
}
