/**
 * Fee / principal ledger package.
 *
 * <p>The protocol performance fee is charged only on swap-fee income, never on principal.
 * This package keeps the two apart across the teardown sequence.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.mercuri.vault.core.ledger.FeeLedger} - Accrued income and owed principal</li>
 *   <li>{@link com.mercuri.vault.core.ledger.PerformanceFee} - {@code floor(base * bps / 10000)}</li>
 *   <li>{@link com.mercuri.vault.core.ledger.LedgerSnapshot} - Point-in-time copy for rollback</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Mercuri Vault Team
 */
package com.mercuri.vault.core.ledger;
