/**
 * Template-driven recommendations keyed by {@link com.insightengine.core.model.CauseCategory}.
 */
package com.insightengine.core.recommendation;
