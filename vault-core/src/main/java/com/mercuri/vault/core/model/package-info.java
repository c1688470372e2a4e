/**
 * Core value types of the vault domain.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.mercuri.vault.core.model.Address} - 20-byte account identity (vaults, owners, tokens, collaborators)</li>
 *   <li>{@link com.mercuri.vault.core.model.PositionId} - Liquidity engine position id ({@code NONE} = 0)</li>
 *   <li>{@link com.mercuri.vault.core.model.TokenPair} - Sorted token pair of a pool</li>
 *   <li>{@link com.mercuri.vault.core.model.PoolKey} - Token pair + fee tier</li>
 *   <li>{@link com.mercuri.vault.core.model.TickRange} - Price range of a position</li>
 *   <li>{@link com.mercuri.vault.core.model.TokenAmounts} - Non-negative amount pair</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All types are final classes or records</li>
 *   <li><strong>Fail-Fast:</strong> Invalid values throw IllegalArgumentException at construction</li>
 *   <li><strong>Exact Arithmetic:</strong> Amounts use BigInteger, never floating point</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Mercuri Vault Team
 */
package com.mercuri.vault.core.model;
