/**
 * Position lifecycle state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.mercuri.vault.core.statemachine.PositionState} - EMPTY / ACTIVE</li>
 *   <li>{@link com.mercuri.vault.core.statemachine.PositionAction} - Lifecycle actions with their required and resulting state</li>
 *   <li>{@link com.mercuri.vault.core.statemachine.PositionTransition} - Transition validation</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * EMPTY  → ACTIVE (mint)
 * ACTIVE → ACTIVE (increase, decrease, collect)
 * ACTIVE → EMPTY  (burn, close)
 *
 * Forbidden:
 * - mint while ACTIVE (never two active positions)
 * - any position action while EMPTY except mint
 * </pre>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * PositionState state = PositionState.EMPTY;
 * state = PositionTransition.transition(state, PositionAction.MINT);
 * state = PositionTransition.transition(state, PositionAction.CLOSE);
 *
 * // This will throw VaultException (INVALID_STATE)
 * PositionTransition.validate(state, PositionAction.BURN);
 * </pre>
 *
 * @since 1.0.0
 * @author Mercuri Vault Team
 */
package com.mercuri.vault.core.statemachine;
