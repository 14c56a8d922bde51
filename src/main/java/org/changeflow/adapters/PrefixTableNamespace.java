package org.changeflow.adapters;

import lombok.RequiredArgsConstructor;
import org.changeflow.configuration.ChangeflowProperties;
import org.springframework.stereotype.Component;

/**
 * Names tables {@code <prefix><datasetId>} and {@code <prefix><datasetId><infix><changeRequestId>},
 * e.g. {@code ds_7} and {@code ds_7_stg_42}.
 */
@Component
@RequiredArgsConstructor
public class PrefixTableNamespace implements TableNamespace {

    private final ChangeflowProperties properties;

    @Override
    public TableRef canonical(Long datasetId) {
        requireId(datasetId, "datasetId");
        ChangeflowProperties.StorageConfig storage = properties.getStorage();
        return new TableRef(storage.getSchema(), storage.getTablePrefix() + datasetId);
    }

    @Override
    public TableRef staging(Long datasetId, Long changeRequestId) {
        requireId(datasetId, "datasetId");
        requireId(changeRequestId, "changeRequestId");
        ChangeflowProperties.StorageConfig storage = properties.getStorage();
        return new TableRef(storage.getSchema(),
                storage.getTablePrefix() + datasetId + storage.getStagingInfix() + changeRequestId);
    }

    private void requireId(Long id, String name) {
        if (id == null || id <= 0) {
            throw new IllegalArgumentException(name + " must be a positive id");
        }
    }
}
