package org.worksindex.models.dto;

import java.util.List;

public record RelationTablesRequest(
        List<CrossrefRelationRow> crossref,
        List<DataCiteRelationRow> datacite,
        List<DataCitationRow> dataCitationCorpus
) {
    public RelationTablesRequest {
        crossref = crossref == null ? List.of() : crossref;
        datacite = datacite == null ? List.of() : datacite;
        dataCitationCorpus = dataCitationCorpus == null ? List.of() : dataCitationCorpus;
    }
}
