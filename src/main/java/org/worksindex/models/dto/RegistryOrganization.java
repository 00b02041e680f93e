package org.worksindex.models.dto;

import java.util.List;

public record RegistryOrganization(String id, String name, List<ExternalId> externalIds) {
}
