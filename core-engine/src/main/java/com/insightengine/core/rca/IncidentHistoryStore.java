package com.insightengine.core.rca;

import com.insightengine.core.model.SimilarIncident;

import java.util.List;

/**
 * Source of past incidents for similar-incident lookups.
 *
 * <p>
 * Implementations own the storage; the analyzer only states what it asks for
 * through {@link IncidentQuery}.
 * </p>
 */
public interface IncidentHistoryStore {

    /**
     * @param query filter, ordering and limit
     * @return matching incidents, most recent first, never {@code null}
     */
    List<SimilarIncident> findSimilar(IncidentQuery query);
}
