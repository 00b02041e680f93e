package org.worksindex.models.dto;

import java.util.List;

public record ExternalId(String type, List<String> all) {
}
