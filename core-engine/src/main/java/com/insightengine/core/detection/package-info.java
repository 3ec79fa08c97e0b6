/**
 * Outlier tests over a single metric series, plus the caller-side helpers
 * built on them: deduplication, trend patterns and cross-metric correlation.
 */
package com.insightengine.core.detection;
