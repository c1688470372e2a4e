/**
 * Public vault API package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.mercuri.vault.application.vault.Vault} - Every owner and manager entry point</li>
 *   <li>{@link com.mercuri.vault.application.vault.VaultSnapshot} - Immutable view of the persisted surface</li>
 * </ul>
 *
 * <h2>Operation Classes</h2>
 * <pre>
 * DELEGATED  (owner or approved manager): mint, increaseLiquidity, decreaseLiquidity,
 *                                         collect, burn, closePosition, rebalance
 * OWNER_ONLY (owner):                     withdrawAll, deposit, setManager, setUnwrapNative
 * </pre>
 *
 * @since 1.0.0
 * @author Mercuri Vault Team
 */
package com.mercuri.vault.application.vault;
