package com.insightengine.core.model;

import java.time.Instant;
import java.util.Objects;

public final class TimelineEvent {

    private final Instant timestamp;
    private final String event;
    private final String impact;

    public TimelineEvent(Instant timestamp, String event, String impact) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.impact = impact;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getEvent() {
        return event;
    }

    public String getImpact() {
        return impact;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimelineEvent that))
            return false;
        return timestamp.equals(that.timestamp) && event.equals(that.event) && Objects.equals(impact, that.impact);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, event, impact);
    }

    @Override
    public String toString() {
        return "TimelineEvent{" + timestamp + ": " + event + '}';
    }
}
