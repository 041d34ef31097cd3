/**
 * Consumer-facing loader handle.
 *
 * <p>{@link com.ryuqq.reskit.application.loader.ResLoader} tracks the references
 * one consumer holds, rejects stale async results by version, and releases
 * everything it owns in one call.</p>
 *
 * @since 1.0.0
 * @author ResKit Team
 */
package com.ryuqq.reskit.application.loader;
