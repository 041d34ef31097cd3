/**
 * Archive storage: bundle dependency graph and the archive backend.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reskit.adapter.runner.archive.DependencyGraph} - Refcounted transitive bundle load/unload with one pinned bundle</li>
 *   <li>{@link com.ryuqq.reskit.adapter.runner.archive.BundleNode} - Read-only view of one bundle</li>
 *   <li>{@link com.ryuqq.reskit.adapter.runner.archive.ArchiveBackend} - Backend that resolves assets through their bundle</li>
 *   <li>{@link com.ryuqq.reskit.adapter.runner.archive.ArchiveConfig} - Pinned bundle settings</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>
 * ui_atlas → shaders (pinned)
 *
 * load(ui_atlas):   shaders 0 → 1, ui_atlas 0 → 1
 * unload(ui_atlas): ui_atlas 1 → 0 (released), shaders 1 → 0 (kept, pinned)
 * </pre>
 *
 * @since 1.0.0
 * @author ResKit Team
 */
package com.ryuqq.reskit.adapter.runner.archive;
