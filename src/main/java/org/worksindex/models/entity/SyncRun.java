package org.worksindex.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.worksindex.models.enums.RunStatus;
import org.hibernate.annotations.ColumnDefault;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@Setter
@Entity
@Table(name = "sync_run", schema = "works_index")
public class SyncRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "sync_run_id", nullable = false)
    private Long id;

    @Column(name = "sync_run_uid", nullable = false, length = 40)
    private String syncRunUid;

    @Column(name = "run_date", nullable = false)
    private LocalDate runDate;

    @ColumnDefault("now()")
    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_status", nullable = false, length = 16)
    @ColumnDefault("'RUNNING'")
    private RunStatus runStatus;

    @ColumnDefault("0")
    @Column(name = "rows_in")
    private Integer rowsIn;

    @ColumnDefault("0")
    @Column(name = "upserts")
    private Integer upserts;

    @ColumnDefault("0")
    @Column(name = "deletes")
    private Integer deletes;

    @ColumnDefault("0")
    @Column(name = "pruned")
    private Integer pruned;

    @Column(name = "error_message", length = Integer.MAX_VALUE)
    private String errorMessage;
}
