/**
 * Lifecycle state machines.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reskit.core.statemachine.EntryState} - Cache entry lifecycle</li>
 *   <li>{@link com.ryuqq.reskit.core.statemachine.BundleState} - Bundle node lifecycle</li>
 *   <li>{@link com.ryuqq.reskit.core.statemachine.LoaderState} - Pooled loader lifecycle</li>
 *   <li>{@link com.ryuqq.reskit.core.statemachine.StateTransition} - Transition validation and execution</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * BundleState state = BundleState.UNLOADED;
 * state = StateTransition.transition(state, BundleState.LOADING);
 * state = StateTransition.transition(state, BundleState.READY);
 *
 * // This will throw IllegalStateException
 * StateTransition.validate(state, BundleState.LOADING);
 * </pre>
 *
 * @since 1.0.0
 * @author ResKit Team
 */
package com.ryuqq.reskit.core.statemachine;
