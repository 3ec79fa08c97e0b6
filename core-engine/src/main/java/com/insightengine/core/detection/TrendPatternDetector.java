package com.insightengine.core.detection;

import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.Pattern;
import com.insightengine.core.model.PatternType;
import com.insightengine.core.stats.Stats;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Finds a recent upward or downward trend by comparing the last
 * {@value #RECENT_POINTS} points with everything before them.
 *
 * @since 1.0.0
 */
public class TrendPatternDetector {

    static final int RECENT_POINTS = 7;
    static final double TREND_CHANGE_FRACTION = 0.10;
    static final double TREND_CONFIDENCE = 0.75;

    /**
     * @param series the series; must not be {@code null}
     * @return at most one trend pattern; empty with fewer than
     *         {@code RECENT_POINTS + 1} points, a zero older average or no
     *         clear trend
     */
    public List<Pattern> detect(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        int n = series.size();
        if (n <= RECENT_POINTS) {
            return List.of();
        }

        double[] values = series.values();
        double recentAvg = Stats.mean(values, n - RECENT_POINTS, n);
        double olderAvg = Stats.mean(values, 0, n - RECENT_POINTS);

        if (Math.abs(olderAvg) < Stats.EPSILON) {
            return List.of();
        }
        // relative to |older| so negative-valued series keep their direction
        double change = (recentAvg - olderAvg) / Math.abs(olderAvg);
        String direction;
        if (change > TREND_CHANGE_FRACTION) {
            direction = "upward";
        } else if (change < -TREND_CHANGE_FRACTION) {
            direction = "downward";
        } else {
            return List.of();
        }

        String key = series.getMetricName() + "|trend|" + direction + '|' + series.latest().getTimestamp();
        return List.of(new Pattern(
                UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString(),
                PatternType.TREND,
                String.format(Locale.ROOT, "%s trend in %s: recent average %.2f against %.2f before",
                        direction.substring(0, 1).toUpperCase(Locale.ROOT) + direction.substring(1),
                        series.getMetricName(), recentAvg, olderAvg),
                TREND_CONFIDENCE,
                series.latest().getTimestamp(),
                Map.of("direction", direction,
                        "recentAverage", recentAvg,
                        "olderAverage", olderAvg,
                        "changePercentage", change * 100.0)));
    }
}
