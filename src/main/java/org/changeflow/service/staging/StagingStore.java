package org.changeflow.service.staging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.changeflow.adapters.RowStore;
import org.changeflow.adapters.TableNamespace;
import org.changeflow.adapters.TableRef;
import org.changeflow.models.entity.ChangeRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Isolated holding area for the candidate rows of one change request. Nothing outside the lifecycle reads it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StagingStore {

    private final RowStore rowStore;
    private final TableNamespace tableNamespace;

    public TableRef locationOf(ChangeRequest changeRequest) {
        return tableNamespace.staging(changeRequest.getDataset().getId(), changeRequest.getId());
    }

    public TableRef materialize(ChangeRequest changeRequest, List<Map<String, Object>> rows) {
        TableRef staging = locationOf(changeRequest);
        rowStore.createTableIfMissing(staging);
        int written = rowStore.appendRows(staging, rows);
        log.info("Staged {} rows for change request {} in {}", written, changeRequest.getChangeRequestUid(), staging);
        return staging;
    }

    public List<Map<String, Object>> rows(ChangeRequest changeRequest) {
        return rowStore.readRows(locationOf(changeRequest));
    }

    public List<Map<String, Object>> sample(ChangeRequest changeRequest, int limit) {
        return rowStore.sampleRows(locationOf(changeRequest), limit);
    }

    public boolean exists(ChangeRequest changeRequest) {
        return rowStore.tableExists(locationOf(changeRequest));
    }

    public long count(ChangeRequest changeRequest) {
        return rowStore.countRows(locationOf(changeRequest));
    }

    public void discard(ChangeRequest changeRequest) {
        TableRef staging = locationOf(changeRequest);
        rowStore.dropTable(staging);
        log.info("Discarded staging {} of change request {}", staging, changeRequest.getChangeRequestUid());
    }
}
