/**
 * Service Provider Interfaces for storage backends.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reskit.core.spi.Backend} - One storage kind: sync/async fetch and release</li>
 *   <li>{@link com.ryuqq.reskit.core.spi.BundleStore} - Raw bundle I/O for archive storage</li>
 *   <li>{@link com.ryuqq.reskit.core.spi.BundleManifest} - Validated bundle dependency manifest</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>Implementations are never invoked while an engine lock is held. Completion
 * callbacks run on whatever thread completes the returned future.</p>
 *
 * @since 1.0.0
 * @author ResKit Team
 */
package com.ryuqq.reskit.core.spi;
