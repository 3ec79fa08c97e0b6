/**
 * Injectable structured logging for the computation components.
 *
 * @since 1.0.0
 */
package com.insightengine.core.logging;
