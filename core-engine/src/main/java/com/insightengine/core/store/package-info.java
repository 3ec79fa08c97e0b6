/**
 * Collaborator contracts around the engine: metric history and the anomaly
 * review ledger, with in-memory implementations.
 */
package com.insightengine.core.store;
