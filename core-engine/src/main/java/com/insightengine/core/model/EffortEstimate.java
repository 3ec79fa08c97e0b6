package com.insightengine.core.model;

import java.util.Objects;

public final class EffortEstimate {

    private final EffortLevel level;
    private final String duration;

    public EffortEstimate(EffortLevel level, String duration) {
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.duration = duration;
    }

    public EffortLevel getLevel() {
        return level;
    }

    /**
     * @return free-text estimate such as {@code "2-4 hours"}
     */
    public String getDuration() {
        return duration;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EffortEstimate that))
            return false;
        return level == that.level && Objects.equals(duration, that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, duration);
    }

    @Override
    public String toString() {
        return "EffortEstimate{level=" + level.wireName() + ", duration='" + duration + "'}";
    }
}
