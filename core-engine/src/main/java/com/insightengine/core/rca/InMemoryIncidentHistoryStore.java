package com.insightengine.core.rca;

import com.insightengine.core.model.SimilarIncident;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory {@link IncidentHistoryStore}.
 *
 * @since 1.0.0
 */
public class InMemoryIncidentHistoryStore implements IncidentHistoryStore {

    private final List<SimilarIncident> incidents = new CopyOnWriteArrayList<>();

    public void record(SimilarIncident incident) {
        incidents.add(Objects.requireNonNull(incident, "incident must not be null"));
    }

    public int size() {
        return incidents.size();
    }

    @Override
    public List<SimilarIncident> findSimilar(IncidentQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return incidents.stream()
                .filter(incident -> query.matches(incident.getMetricName(), incident.getPercentageDrop()))
                .sorted(Comparator.comparing(SimilarIncident::getDate).reversed())
                .limit(query.getLimit())
                .toList();
    }
}
