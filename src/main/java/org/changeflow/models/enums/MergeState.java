package org.changeflow.models.enums;

/**
 * Observable merge progress of a change request, derived from its status, quorum and last merge error.
 */
public enum MergeState {
    NOT_READY,
    READY,
    FAILED,
    MERGED,
    DISCARDED
}
