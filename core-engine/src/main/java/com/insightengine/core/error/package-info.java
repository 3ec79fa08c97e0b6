/**
 * Typed failures raised by the engine.
 *
 * <ul>
 * <li>{@link com.insightengine.core.error.InsufficientDataException}: fewer
 * points than an operation's minimum</li>
 * <li>{@link com.insightengine.core.error.InvalidInputException}: misaligned
 * or degenerate input</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.insightengine.core.error;
