package org.worksindex.models.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.worksindex.models.enums.DoiState;

import java.time.LocalDate;

/**
 * One entry of the append-only DOI state history. Rows are never updated; the only
 * mutations are inserts by a sync run and deletes by retention pruning.
 * <p>
 * {@code sequence} orders records appended on the same {@code updatedDate}: the higher
 * sequence was appended later and wins.
 */
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(name = "doi_state", schema = "works_index",
        indexes = {
                @Index(name = "ix_doi_state_doi", columnList = "doi"),
                @Index(name = "ix_doi_state_updated_date", columnList = "updated_date")
        })
public class DoiStateRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "doi_state_id", nullable = false, updatable = false)
    private Long sequence;

    @Column(name = "doi", nullable = false, updatable = false)
    private String doi;

    @Column(name = "hash", nullable = false, updatable = false, length = 32)
    private String hash;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, updatable = false, length = 16)
    private DoiState state;

    @Column(name = "updated_date", nullable = false, updatable = false)
    private LocalDate updatedDate;

    public DoiStateRecord(Long sequence, String doi, String hash, DoiState state, LocalDate updatedDate) {
        this.sequence = sequence;
        this.doi = doi;
        this.hash = hash;
        this.state = state;
        this.updatedDate = updatedDate;
    }

    public static DoiStateRecord of(String doi, String hash, DoiState state, LocalDate updatedDate) {
        return new DoiStateRecord(null, doi, hash, state, updatedDate);
    }

    public DoiStateRecord withSequence(long sequence) {
        return new DoiStateRecord(sequence, doi, hash, state, updatedDate);
    }
}
