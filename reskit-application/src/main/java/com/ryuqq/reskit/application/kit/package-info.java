/**
 * Resource kit facade.
 *
 * <p>{@link com.ryuqq.reskit.application.kit.ResKit} allocates and recycles pooled
 * loaders and resolves generational loader ids.</p>
 *
 * @since 1.0.0
 * @author ResKit Team
 */
package com.ryuqq.reskit.application.kit;
