package com.relationsim.relationship.persistence;

import com.relationsim.common.model.RelationshipSnapshot;

/**
 * Snapshot returned by a load, never null, plus the signal the caller should log.
 *
 * @param snapshot restored state, or the documented defaults
 * @param status   how the snapshot was obtained
 * @param error    reason defaults were used; null when {@code status} is LOADED or DEFAULTED_MISSING
 */
public record LoadResult(
    RelationshipSnapshot snapshot,
    LoadStatus           status,
    String               error
) {

    public static LoadResult loaded(RelationshipSnapshot snapshot) {
        return new LoadResult(snapshot, LoadStatus.LOADED, null);
    }

    public static LoadResult defaulted(RelationshipSnapshot defaults, LoadStatus status, String error) {
        return new LoadResult(defaults, status, error);
    }

    public boolean isDefaulted() {
        return status != LoadStatus.LOADED;
    }
}
