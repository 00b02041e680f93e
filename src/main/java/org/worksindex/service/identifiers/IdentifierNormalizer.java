package org.worksindex.service.identifiers;

import lombok.extern.slf4j.Slf4j;
import org.worksindex.models.dto.ExternalId;
import org.worksindex.models.dto.IdentifierMapping;
import org.worksindex.models.dto.RegistryOrganization;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Slf4j
public final class IdentifierNormalizer {

    public static final String TYPE_ROR = "ror";
    public static final String TYPE_ISNI = "isni";
    public static final String TYPE_FUNDREF = "fundref";

    static final String FUNDREF_DOI_PREFIX = "10.13039/";

    private static final Pattern URL_PREFIX = Pattern.compile("https?://[^/]+/");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private IdentifierNormalizer() {
    }

    public static String normalize(String type, String raw) {
        if (type == null || raw == null || raw.isBlank()) {
            return null;
        }
        String normalizedType = type.trim().toLowerCase(Locale.ROOT);
        return switch (normalizedType) {
            case TYPE_ROR -> normalizeIdentifier(raw);
            case TYPE_ISNI -> normalizeIsni(raw);
            case TYPE_FUNDREF -> FUNDREF_DOI_PREFIX + raw.trim().toLowerCase(Locale.ROOT);
            default -> emptyToNull(raw.trim().toLowerCase(Locale.ROOT));
        };
    }

    public static String normalizeIdentifier(String raw) {
        if (raw == null) {
            return null;
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        return emptyToNull(URL_PREFIX.matcher(lower).replaceAll("").trim());
    }

    public static String normalizeIsni(String raw) {
        if (raw == null) {
            return null;
        }
        return emptyToNull(WHITESPACE.matcher(raw).replaceAll("").toLowerCase(Locale.ROOT));
    }

    public static List<IdentifierMapping> buildRegistryIndex(List<RegistryOrganization> organizations) {
        if (organizations == null || organizations.isEmpty()) {
            return List.of();
        }
        Set<IdentifierMapping> mappings = new LinkedHashSet<>();
        int dropped = 0;
        for (RegistryOrganization organization : organizations) {
            String rorId = organization == null ? null : normalizeIdentifier(organization.id());
            if (rorId == null) {
                dropped++;
                continue;
            }
            mappings.add(new IdentifierMapping(rorId, TYPE_ROR, rorId));
            if (organization.externalIds() == null) {
                continue;
            }
            for (ExternalId externalId : organization.externalIds()) {
                if (externalId == null || externalId.all() == null) {
                    continue;
                }
                String type = externalId.type() == null ? null : externalId.type().trim().toLowerCase(Locale.ROOT);
                for (String value : externalId.all()) {
                    String identifier = normalize(type, value);
                    if (identifier == null) {
                        dropped++;
                        continue;
                    }
                    mappings.add(new IdentifierMapping(rorId, type, identifier));
                }
            }
        }
        if (dropped > 0) {
            log.info("[identifiers] Dropped {} registry identifiers that could not be normalized", dropped);
        }
        return new ArrayList<>(mappings);
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
