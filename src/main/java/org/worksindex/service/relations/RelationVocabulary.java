package org.worksindex.service.relations;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Controlled relation-type vocabularies of the relation sources, mapped to the two
 * categories used for ranking. Tokens are matched exactly; unknown tokens carry neither
 * category.
 */
public enum RelationVocabulary {

    /**
     * Crossref relationship types.
     * Intra-work: expression, format, identical, manifestation, manuscript, preprint,
     * replacement, translation, variant, version.
     * Shared project: basis, continuation, derivation, documentation, part, related
     * material, software compilation, supplement.
     */
    CROSSREF(
            Set.of("is-expression-of", "has-expression", "is-format-of", "has-format", "is-identical-to",
                    "is-manifestation-of", "has-manifestation", "is-manuscript-of", "has-manuscript",
                    "is-preprint-of", "has-preprint", "is-replaced-by", "replaces", "is-translation-of",
                    "has-translation", "is-variant-form-of", "is-original-form-of", "is-version-of"),
            Set.of("is-derived-from", "has-derivation", "is-basis-for", "is-based-on", "is-supplement-to",
                    "is-supplemented-by", "documents", "is-documented-by", "has-part", "is-part-of", "continues",
                    "is-continued-by", "compiles", "is-compiled-by", "is-related-material", "has-related-material")
    ),

    /**
     * DataCite relationType values.
     * Intra-work: identical, obsoleted, part, published in, translation, variant, version.
     * Shared project: compilation, continuation, derivation, description, documentation,
     * supplement.
     */
    DATACITE(
            Set.of("IsIdenticalTo", "IsObsoletedBy", "Obsoletes", "IsPartOf", "HasPart", "IsPublishedIn",
                    "IsTranslationOf", "HasTranslation", "IsVariantFormOf", "IsOriginalFormOf",
                    "HasVersion", "IsVersionOf", "IsNewVersionOf", "IsPreviousVersionOf"),
            Set.of("Compiles", "IsCompiledBy", "Continues", "IsContinuedBy", "IsDerivedFrom", "IsSourceOf",
                    "Describes", "IsDescribedBy", "Documents", "IsDocumentedBy", "IsSupplementTo",
                    "IsSupplementedBy")
    );

    private static final RelationCategories NONE = new RelationCategories(false, false);

    private final Map<String, RelationCategories> categories;

    RelationVocabulary(Set<String> intraWork, Set<String> possibleSharedProject) {
        Map<String, RelationCategories> mapping = new LinkedHashMap<>();
        for (String token : intraWork) {
            mapping.put(token, new RelationCategories(true, possibleSharedProject.contains(token)));
        }
        for (String token : possibleSharedProject) {
            mapping.putIfAbsent(token, new RelationCategories(false, true));
        }
        this.categories = Map.copyOf(mapping);
    }

    public RelationCategories classify(String relationType) {
        if (relationType == null) {
            return NONE;
        }
        return categories.getOrDefault(relationType, NONE);
    }

    public Map<String, RelationCategories> mappings() {
        return categories;
    }

    public record RelationCategories(boolean intraWork, boolean possibleSharedProject) {
    }
}
