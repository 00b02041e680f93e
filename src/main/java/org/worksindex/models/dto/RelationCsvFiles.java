package org.worksindex.models.dto;

import java.nio.file.Path;

public record RelationCsvFiles(Path crossref, Path datacite, Path dataCitationCorpus) {
}
