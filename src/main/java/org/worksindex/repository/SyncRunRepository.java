package org.worksindex.repository;

import org.worksindex.models.entity.SyncRun;
import org.worksindex.models.enums.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface SyncRunRepository extends JpaRepository<SyncRun, Long> {

    Optional<SyncRun> findFirstByRunDateAndRunStatusOrderByStartedAtDesc(LocalDate runDate, RunStatus runStatus);

    boolean existsByRunStatusAndUpsertsGreaterThan(RunStatus runStatus, Integer upserts);
}
