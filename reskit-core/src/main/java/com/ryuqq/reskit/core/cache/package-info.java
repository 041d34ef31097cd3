/**
 * Shared reference-counted cache.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reskit.core.cache.ResourceCache} - Key to entry map, sole owner of refcount transitions</li>
 *   <li>{@link com.ryuqq.reskit.core.cache.CacheEntry} - Read-only view of one cached resource</li>
 *   <li>{@link com.ryuqq.reskit.core.cache.BackendRegistry} - Backend per storage kind, fixed at construction</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * insert (refCount=1, READY)
 *   → addRef / release ...
 *   → release to 0, not pinned: removed, INVALID, Backend.release exactly once
 * </pre>
 *
 * @since 1.0.0
 * @author ResKit Team
 */
package com.ryuqq.reskit.core.cache;
