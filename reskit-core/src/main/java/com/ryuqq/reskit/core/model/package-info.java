/**
 * Core value objects of the resource kit.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reskit.core.model.BackendKind} - Storage kind (closed set)</li>
 *   <li>{@link com.ryuqq.reskit.core.model.ResourceKey} - (kind, path) key, rendered as {@code KIND://path}</li>
 *   <li>{@link com.ryuqq.reskit.core.model.Asset} - Opaque loaded content plus backend metadata</li>
 *   <li>{@link com.ryuqq.reskit.core.model.LoaderId} - Generational handle of a pooled loader</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Type Safety:</strong> Backend kinds are an enum, never free-form strings</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ResKit Team
 */
package com.ryuqq.reskit.core.model;
