package org.changeflow.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.changeflow.adapters.RowStore;
import org.changeflow.adapters.TableNamespace;
import org.changeflow.adapters.TableRef;
import org.changeflow.models.entity.Dataset;
import org.changeflow.models.entity.DatasetMeta;
import org.changeflow.models.enums.ChangeRequestStatus;
import org.changeflow.repository.ChangeRequestRepository;
import org.changeflow.repository.DatasetMetaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Derived dataset statistics. Always recomputed from the canonical table, never edited directly.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetMetaService {

    private final DatasetMetaRepository datasetMetaRepository;
    private final ChangeRequestRepository changeRequestRepository;
    private final RowStore rowStore;
    private final TableNamespace tableNamespace;

    @Transactional(propagation = Propagation.MANDATORY)
    public DatasetMeta recompute(Dataset dataset) {
        TableRef canonical = tableNamespace.canonical(dataset.getId());
        DatasetMeta meta = metaFor(dataset);
        meta.setRowCount(rowStore.countRows(canonical));
        meta.setColumnCount(columnCount(dataset, canonical));
        meta.setOwnerName(dataset.getProject().getOwner().getName());
        meta.setTableLocation(canonical.qualified());
        meta.setLastUpdateAt(Instant.now());
        meta.setPendingApprovals(pendingCount(dataset));
        datasetMetaRepository.save(meta);
        log.info("Dataset {} meta: rows={} columns={} pending={}", dataset.getId(), meta.getRowCount(),
                meta.getColumnCount(), meta.getPendingApprovals());
        return meta;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void refreshPending(Dataset dataset) {
        DatasetMeta meta = metaFor(dataset);
        meta.setPendingApprovals(pendingCount(dataset));
        datasetMetaRepository.save(meta);
    }

    private DatasetMeta metaFor(Dataset dataset) {
        return datasetMetaRepository.findByDataset_Id(dataset.getId()).orElseGet(() -> {
            DatasetMeta created = new DatasetMeta();
            created.setDataset(dataset);
            created.setRowCount(0L);
            created.setColumnCount(0);
            created.setPendingApprovals(0);
            created.setOwnerName(dataset.getProject().getOwner().getName());
            created.setTableLocation(tableNamespace.canonical(dataset.getId()).qualified());
            return created;
        });
    }

    private int pendingCount(Dataset dataset) {
        return (int) changeRequestRepository.countByDataset_IdAndStatus(dataset.getId(), ChangeRequestStatus.PENDING);
    }

    private int columnCount(Dataset dataset, TableRef canonical) {
        Map<String, Object> schema = dataset.getSchemaDefinition();
        if (schema != null && schema.get("properties") instanceof Map<?, ?> properties && !properties.isEmpty()) {
            return properties.size();
        }
        List<Map<String, Object>> sample = rowStore.sampleRows(canonical, 1);
        return sample.isEmpty() ? 0 : sample.get(0).size();
    }
}
