package org.changeflow.repository;

import org.changeflow.models.entity.DatasetMeta;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DatasetMetaRepository extends JpaRepository<DatasetMeta, Long> {

    Optional<DatasetMeta> findByDataset_Id(Long datasetId);
}
