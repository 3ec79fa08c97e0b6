/**
 * Immutable value types exchanged with callers: metric series, anomalies,
 * forecasts, root-cause analyses and recommendations.
 *
 * <p>
 * Every enum serializes to its lower-case wire name.
 * </p>
 */
package com.insightengine.core.model;
