package org.worksindex.repository;

import org.worksindex.models.entity.DoiStateRecord;
import org.worksindex.models.enums.DoiState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface DoiStateRecordRepository extends JpaRepository<DoiStateRecord, Long> {

    List<DoiStateRecord> findByDoiOrderByUpdatedDateDescSequenceDesc(String doi);

    List<DoiStateRecord> findByUpdatedDateAndStateOrderByDoiAsc(LocalDate updatedDate, DoiState state);

    @Query("select max(r.updatedDate) from DoiStateRecord r")
    LocalDate findLatestUpdatedDate();

    @Query("select r.doi from DoiStateRecord r group by r.doi having count(r) > :maxStates")
    List<String> findDoisWithMoreStatesThan(@Param("maxStates") long maxStates);
}
