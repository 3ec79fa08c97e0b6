/**
 * Engine options and the recommendation catalog, loaded from YAML with
 * SnakeYAML.
 */
package com.insightengine.core.config;
