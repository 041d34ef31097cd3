/**
 * Load outcome package.
 *
 * <p>This package defines the sealed {@link com.ryuqq.reskit.core.outcome.LoadResult}
 * hierarchy returned by every load operation.</p>
 *
 * <h2>Outcome Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reskit.core.outcome.Loaded} - Success, the caller now holds one reference</li>
 *   <li>{@link com.ryuqq.reskit.core.outcome.NotFound} - Missing resource or discarded stale result</li>
 *   <li>{@link com.ryuqq.reskit.core.outcome.Failure} - Backend failure, concurrency conflict or unsupported sync fetch</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ResKit Team
 */
package com.ryuqq.reskit.core.outcome;
