package org.worksindex.service.canonical;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.worksindex.models.dto.Author;
import org.worksindex.models.dto.Award;
import org.worksindex.models.dto.CanonicalWork;
import org.worksindex.models.dto.Funder;
import org.worksindex.models.dto.Institution;
import org.worksindex.models.dto.SourceInfo;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Function;

public final class ContentHasher {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ContentHasher() {
    }

    public static String hash(CanonicalWork work) {
        try {
            byte[] content = MAPPER.writeValueAsString(canonicalContent(work)).getBytes(StandardCharsets.UTF_8);
            MessageDigest digest = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (JsonProcessingException exception) {
            throw new IllegalStateException("Failed to serialize work " + work.doi() + " for hashing", exception);
        } catch (NoSuchAlgorithmException exception) {
            throw new IllegalStateException("MD5 digest is not available", exception);
        }
    }

    // keys in fixed order; doi and updatedDate are not content
    static ObjectNode canonicalContent(CanonicalWork work) {
        ObjectNode node = NODES.objectNode();
        node.put("title", work.title());
        node.put("abstract_text", work.abstractText());
        node.put("work_type", work.workType().name());
        node.put("publication_date", work.publicationDate() == null ? null : work.publicationDate().toString());
        node.put("publication_venue", work.publicationVenue());
        node.set("institutions", array(work.institutions(), ContentHasher::institution));
        node.set("authors", array(work.authors(), ContentHasher::author));
        node.set("funders", array(work.funders(), ContentHasher::funder));
        node.set("awards", array(work.awards(), ContentHasher::award));
        node.set("source", source(work.source()));
        return node;
    }

    private static <T> ArrayNode array(List<T> items, Function<T, ObjectNode> mapper) {
        ArrayNode array = NODES.arrayNode();
        for (T item : items) {
            if (item == null) {
                array.addNull();
            } else {
                array.add(mapper.apply(item));
            }
        }
        return array;
    }

    private static ObjectNode institution(Institution institution) {
        ObjectNode node = NODES.objectNode();
        node.put("name", institution.name());
        node.put("ror", institution.ror());
        return node;
    }

    private static ObjectNode author(Author author) {
        ObjectNode node = NODES.objectNode();
        node.put("orcid", author.orcid());
        node.put("first_initial", author.firstInitial());
        node.put("given_name", author.givenName());
        node.put("middle_initials", author.middleInitials());
        node.put("middle_names", author.middleNames());
        node.put("surname", author.surname());
        node.put("full", author.full());
        return node;
    }

    private static ObjectNode funder(Funder funder) {
        ObjectNode node = NODES.objectNode();
        node.put("name", funder.name());
        node.put("ror", funder.ror());
        return node;
    }

    private static ObjectNode award(Award award) {
        ObjectNode node = NODES.objectNode();
        node.put("award_id", award.awardId());
        return node;
    }

    private static ObjectNode source(SourceInfo source) {
        ObjectNode node = NODES.objectNode();
        node.put("name", source == null ? null : source.name());
        node.put("url", source == null ? null : source.url());
        return node;
    }
}
