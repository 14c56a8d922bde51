package org.changeflow.service.merge;

public record MergeResult(Long changeRequestId, long rowsAppended, long rowCountAfter, boolean alreadyMerged) {
}
