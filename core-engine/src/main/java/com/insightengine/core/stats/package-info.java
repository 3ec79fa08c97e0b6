/**
 * Statistics library: summary statistics, Pearson correlation, least-squares
 * regression and mean absolute error.
 *
 * @since 1.0.0
 */
package com.insightengine.core.stats;
