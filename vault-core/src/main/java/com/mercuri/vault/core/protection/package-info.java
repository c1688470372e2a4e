/**
 * Execution protection package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.mercuri.vault.core.protection.ReentrancyGuard} - Single-flight guard shared by every mutating entry point of one vault</li>
 *   <li>{@link com.mercuri.vault.core.protection.noop.NoOpStateJournal} - Journal for environments that revert collaborators themselves</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Fail-Fast:</strong> Nested entry is rejected before any state is read or written</li>
 *   <li><strong>Serialization:</strong> Entry from another thread waits; there is no internal parallelism</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Mercuri Vault Team
 */
package com.mercuri.vault.core.protection;
