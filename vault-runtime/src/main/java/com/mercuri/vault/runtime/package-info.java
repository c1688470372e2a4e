/**
 * Vault runtime package.
 *
 * <p>This package implements {@link com.mercuri.vault.application.vault.Vault} by composing the core
 * authorization gate, lifecycle state machine, fee ledger and reentrancy guard with the external
 * collaborators supplied in {@link com.mercuri.vault.runtime.VaultCollaborators}.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.mercuri.vault.runtime.ConcentratedLiquidityVault} - Public entry point</li>
 *   <li>{@link com.mercuri.vault.runtime.VaultConfig} - Creation settings</li>
 *   <li>{@link com.mercuri.vault.runtime.VaultCollaborators} - External collaborator bundle</li>
 * </ul>
 *
 * <h2>Teardown Order</h2>
 * <pre>
 * 1. collect while liquidity is non-zero  → swap-fee income (fee base)
 * 2. apply performance fee                → ledger drained to zero
 * 3. decrease 100% liquidity (no floors)  → principal moved to owed balance
 * 4. collect again                        → principal, never taxed
 * </pre>
 *
 * @since 1.0.0
 * @author Mercuri Vault Team
 */
package com.mercuri.vault.runtime;
