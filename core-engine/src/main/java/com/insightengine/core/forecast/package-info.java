/**
 * Closed-form forecasting: smoothed least-squares trend, prediction intervals
 * and a heuristic risk score.
 */
package com.insightengine.core.forecast;
