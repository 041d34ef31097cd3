/**
 * Resource kit engine.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reskit.adapter.runner.LoadCoordinator} - Collapses concurrent identical requests into one backend call</li>
 *   <li>{@link com.ryuqq.reskit.adapter.runner.PooledResLoader} - Versioned consumer handle with stale-result rejection</li>
 *   <li>{@link com.ryuqq.reskit.adapter.runner.LoaderPool} - Per-kind LIFO pool over a generational arena</li>
 *   <li>{@link com.ryuqq.reskit.adapter.runner.DefaultResKit} - Facade owning cache, coordinator and pool</li>
 *   <li>{@link com.ryuqq.reskit.adapter.runner.ResKitConfig} - Preload batch size</li>
 * </ul>
 *
 * <h2>Lock Order</h2>
 * <pre>
 * LoaderPool → PooledResLoader
 * ResourceCache (shared with LoadCoordinator)
 * DependencyGraph
 * </pre>
 * <p>Cache releases and backend calls are made after the loader and pool monitors
 * are released, so no thread holds a loader monitor while waiting on the cache.</p>
 *
 * @since 1.0.0
 * @author ResKit Team
 */
package com.ryuqq.reskit.adapter.runner;
