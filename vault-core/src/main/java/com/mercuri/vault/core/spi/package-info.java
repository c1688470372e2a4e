/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces of every external collaborator the vault consumes.
 * The vault owns none of these; it only calls them correctly.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.mercuri.vault.core.spi.LiquidityEngine} - Position manager (mint, increase, decrease, collect, burn)</li>
 *   <li>{@link com.mercuri.vault.core.spi.SwapEngine} - Exact-input single-hop swaps</li>
 *   <li>{@link com.mercuri.vault.core.spi.ManagerRegistry} - Live manager approval lookup</li>
 *   <li>{@link com.mercuri.vault.core.spi.ProtocolFeeSource} - Live protocol fee rate and recipient</li>
 *   <li>{@link com.mercuri.vault.core.spi.WrappedNativeAsset} - Wrap / unwrap of the native currency</li>
 *   <li>{@link com.mercuri.vault.core.spi.TokenLedger} - Token balances and allowances</li>
 *   <li>{@link com.mercuri.vault.core.spi.NativeCurrency} - Native currency transfers</li>
 *   <li>{@link com.mercuri.vault.core.spi.PoolDirectory} - Pool identity lookup</li>
 *   <li>{@link com.mercuri.vault.core.spi.VaultEventListener} - Notification sink</li>
 *   <li>{@link com.mercuri.vault.core.spi.StateJournal} - Checkpoint / revert of collaborator state</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., vault-adapter-inmemory, or an on-chain client) provide concrete
 * implementations of these SPIs.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Live reads:</strong> Registry approval and fee configuration are queried on every use, never cached</li>
 *   <li><strong>Untrusted collaborators:</strong> Calls may call back into the vault; the reentrancy guard rejects nested entry</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Mercuri Vault Team
 */
package com.mercuri.vault.core.spi;
