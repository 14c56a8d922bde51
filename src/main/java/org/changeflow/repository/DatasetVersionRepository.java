package org.changeflow.repository;

import org.changeflow.models.entity.DatasetVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DatasetVersionRepository extends JpaRepository<DatasetVersion, Long> {

    List<DatasetVersion> findAllByDataset_IdOrderByIdDesc(Long datasetId);

    long countByChangeRequest_Id(Long changeRequestId);
}
