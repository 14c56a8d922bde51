package org.changeflow.adapters;

/**
 * Two-level naming scheme: one canonical table per dataset, one staging table per in-flight change request.
 */
public interface TableNamespace {

    TableRef canonical(Long datasetId);

    TableRef staging(Long datasetId, Long changeRequestId);
}
