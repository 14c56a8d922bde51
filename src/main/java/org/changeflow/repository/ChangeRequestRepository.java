package org.changeflow.repository;

import jakarta.persistence.LockModeType;
import org.changeflow.models.entity.ChangeRequest;
import org.changeflow.models.enums.ChangeRequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ChangeRequestRepository extends JpaRepository<ChangeRequest, Long> {

    Optional<ChangeRequest> findByChangeRequestUid(String changeRequestUid);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select cr from ChangeRequest cr where cr.changeRequestUid = :uid")
    Optional<ChangeRequest> findByUidForUpdate(@Param("uid") String uid);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select cr from ChangeRequest cr where cr.id = :id")
    Optional<ChangeRequest> findByIdForUpdate(@Param("id") Long id);

    @Query("select cr.dataset.id from ChangeRequest cr where cr.id = :id")
    Optional<Long> findDatasetIdById(@Param("id") Long id);

    long countByDataset_IdAndStatus(Long datasetId, ChangeRequestStatus status);

    List<ChangeRequest> findAllByDataset_IdOrderByCreatedAtDesc(Long datasetId);

    List<ChangeRequest> findAllByDataset_IdAndStatusOrderByCreatedAtDesc(Long datasetId, ChangeRequestStatus status);

    List<ChangeRequest> findAllByDataset_Project_IdInOrderByCreatedAtDesc(Collection<Long> projectIds);

    List<ChangeRequest> findAllByDataset_Project_IdInAndStatusOrderByCreatedAtDesc(Collection<Long> projectIds,
                                                                                 ChangeRequestStatus status);
}
