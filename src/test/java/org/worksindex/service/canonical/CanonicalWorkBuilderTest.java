package org.worksindex.service.canonical;

import org.junit.jupiter.api.Test;
import org.worksindex.exceptions.InputSchemaException;
import org.worksindex.models.dto.Author;
import org.worksindex.models.dto.Award;
import org.worksindex.models.dto.AwardsRow;
import org.worksindex.models.dto.CanonicalWork;
import org.worksindex.models.dto.Funder;
import org.worksindex.models.dto.FundersRow;
import org.worksindex.models.dto.Institution;
import org.worksindex.models.dto.InstitutionsRow;
import org.worksindex.models.dto.SourceInfo;
import org.worksindex.models.dto.SupplementalTables;
import org.worksindex.models.dto.UpdatedDateRow;
import org.worksindex.models.dto.WorkSourceRow;
import org.worksindex.models.dto.WorkTypeRow;
import org.worksindex.models.enums.WorkSource;
import org.worksindex.models.enums.WorkType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CanonicalWorkBuilderTest {

    private static WorkSourceRow row(String doi) {
        return new WorkSourceRow(doi, "W" + doi.hashCode(), "Title " + doi, "Abstract", LocalDate.of(2024, 1, 2),
                "Venue", List.of(new Author("0000-0002-1825-0097", "J", "Josiah", null, null, "Carberry", "Josiah Carberry")));
    }

    @Test
    void joinsSupplementalTablesOnDoi() {
        SupplementalTables tables = new SupplementalTables(
                List.of(new WorkTypeRow("10.1/a", "Dataset")),
                List.of(new UpdatedDateRow("10.1/a", Instant.parse("2024-05-01T10:00:00Z"))),
                List.of(new InstitutionsRow("10.1/a", List.of(new Institution("Uni", "01abc")))),
                List.of(new FundersRow("10.1/a", List.of(new Funder("NSF", "021nxhr62")))),
                List.of(new AwardsRow("10.1/a", List.of(new Award("1234567"))))
        );

        List<CanonicalWork> works = CanonicalWorkBuilder.build(WorkSource.DATACITE, List.of(row("10.1/a")), tables);

        assertThat(works).hasSize(1);
        CanonicalWork work = works.get(0);
        assertThat(work.workType()).isEqualTo(WorkType.DATASET);
        assertThat(work.updatedDate()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(work.institutions()).containsExactly(new Institution("Uni", "01abc"));
        assertThat(work.funders()).containsExactly(new Funder("NSF", "021nxhr62"));
        assertThat(work.awards()).containsExactly(new Award("1234567"));
        assertThat(work.source()).isEqualTo(new SourceInfo("DataCite", "https://commons.datacite.org/doi.org/10.1/a"));
    }

    @Test
    void missingSupplementalRowsDefaultToEmptyListsAndFallbackType() {
        List<CanonicalWork> works = CanonicalWorkBuilder.build(WorkSource.OPENALEX,
                List.of(row("10.1/a"), row("10.1/b")),
                new SupplementalTables(List.of(new WorkTypeRow("10.1/b", "not-a-known-type")), null, null, null, null));

        assertThat(works).extracting(CanonicalWork::doi).containsExactly("10.1/a", "10.1/b");
        for (CanonicalWork work : works) {
            assertThat(work.workType()).isEqualTo(WorkType.OTHER);
            assertThat(work.institutions()).isNotNull().isEmpty();
            assertThat(work.funders()).isNotNull().isEmpty();
            assertThat(work.awards()).isNotNull().isEmpty();
            assertThat(work.updatedDate()).isNull();
            assertThat(work.source().name()).isEqualTo("OpenAlex");
            assertThat(work.source().url()).startsWith("https://openalex.org/W");
        }
    }

    @Test
    void supplementalRowsWithoutPrimaryRowAreIgnored() {
        List<CanonicalWork> works = CanonicalWorkBuilder.build(WorkSource.DATACITE, List.of(row("10.1/a")),
                new SupplementalTables(null, null, null, null, List.of(new AwardsRow("10.1/zzz", List.of(new Award("x"))))));

        assertThat(works).singleElement().satisfies(work -> assertThat(work.awards()).isEmpty());
    }

    @Test
    void nullAuthorsBecomeEmptyList() {
        WorkSourceRow noAuthors = new WorkSourceRow("10.1/a", null, "T", null, null, null, null);

        CanonicalWork work = CanonicalWorkBuilder.build(WorkSource.DATACITE, List.of(noAuthors), null).get(0);

        assertThat(work.authors()).isEmpty();
    }

    @Test
    void duplicatePrimaryDoiIsRejected() {
        assertThatThrownBy(() -> CanonicalWorkBuilder.build(WorkSource.DATACITE, List.of(row("10.1/a"), row("10.1/a")), null))
                .isInstanceOf(InputSchemaException.class)
                .hasMessageContaining("duplicate doi");
    }

    @Test
    void duplicateSupplementalDoiIsRejected() {
        SupplementalTables tables = new SupplementalTables(
                List.of(new WorkTypeRow("10.1/a", "Text"), new WorkTypeRow("10.1/a", "Dataset")), null, null, null, null);

        assertThatThrownBy(() -> CanonicalWorkBuilder.build(WorkSource.DATACITE, List.of(row("10.1/a")), tables))
                .isInstanceOf(InputSchemaException.class)
                .hasMessageContaining("types");
    }

    @Test
    void rowWithoutDoiIsRejected() {
        WorkSourceRow blank = new WorkSourceRow(" ", null, "T", null, null, null, List.of());

        assertThatThrownBy(() -> CanonicalWorkBuilder.build(WorkSource.OPENALEX, List.of(blank), null))
                .isInstanceOf(InputSchemaException.class)
                .hasMessageContaining("has no doi");
    }

    @Test
    void missingPrimaryTableIsRejected() {
        assertThatThrownBy(() -> CanonicalWorkBuilder.build(WorkSource.OPENALEX, null, null))
                .isInstanceOf(InputSchemaException.class);
    }

    @Test
    void workTypeSpellingsAreRecognised() {
        assertThat(WorkType.fromValue("BookChapter")).isEqualTo(WorkType.BOOK_CHAPTER);
        assertThat(WorkType.fromValue("book-chapter")).isEqualTo(WorkType.BOOK_CHAPTER);
        assertThat(WorkType.fromValue("OutputManagementPlan")).isEqualTo(WorkType.OUTPUT_MANAGEMENT_PLAN);
        assertThat(WorkType.fromValue("article")).isEqualTo(WorkType.ARTICLE);
        assertThat(WorkType.fromValue(null)).isEqualTo(WorkType.OTHER);
    }
}
