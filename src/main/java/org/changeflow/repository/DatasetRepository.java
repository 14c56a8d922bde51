package org.changeflow.repository;

import jakarta.persistence.LockModeType;
import org.changeflow.models.entity.Dataset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DatasetRepository extends JpaRepository<Dataset, Long> {

    List<Dataset> findAllByProject_IdOrderByIdAsc(Long projectId);

    Optional<Dataset> findByNameIgnoreCaseAndProject_Id(String name, Long projectId);

    /**
     * Row lock held for the duration of a canonical-table mutation, so two commits on the same dataset
     * never interleave.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from Dataset d where d.id = :id")
    Optional<Dataset> findByIdForUpdate(@Param("id") Long id);
}
