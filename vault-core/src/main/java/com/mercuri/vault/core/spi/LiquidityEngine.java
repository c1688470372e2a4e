package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;

/**
 * Concentrated-liquidity position manager SPI.
 *
 * <p>The vault treats this collaborator as untrusted: every call is validated before it is made,
 * and any callback into the vault during a call is subject to the reentrancy guard.</p>
 *
 * <p><strong>Accounting model assumed by the vault:</strong></p>
 * <ul>
 *   <li>Swap-fee income accrues to the position while liquidity is non-zero</li>
 *   <li>{@code decreaseLiquidity} moves principal into the position's owed balance</li>
 *   <li>{@code collect} pays out the owed balance (fees, plus any principal already moved there)</li>
 *   <li>{@code burn} succeeds only when liquidity and owed balance are both zero</li>
 * </ul>
 *
 * <p><strong>Caller identity:</strong> {@code caller} is the account on whose behalf the call is made
 * (the vault). Implementations pull tokens from it through the {@link TokenLedger} allowance granted to
 * {@link #address()}.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public interface LiquidityEngine {

    /**
     * The engine's own account (spender for token allowances).
     *
     * @return engine address
     */
    Address address();

    /**
     * Mints a new position.
     *
     * @param caller account paying the desired amounts
     * @param params mint parameters
     * @return minted position id, liquidity and amounts actually used
     * @throws com.mercuri.vault.core.error.VaultException SLIPPAGE_VIOLATION if amounts used are below the minimums
     */
    MintResult mint(Address caller, MintParams params);

    /**
     * Adds liquidity to an existing position.
     *
     * @param caller position owner
     * @param params increase parameters
     * @return amounts actually added
     */
    TokenAmounts increaseLiquidity(Address caller, IncreaseLiquidityParams params);

    /**
     * Removes liquidity and moves the released principal into the owed balance.
     *
     * @param caller position owner
     * @param params decrease parameters
     * @return principal amounts moved into the owed balance
     */
    TokenAmounts decreaseLiquidity(Address caller, DecreaseLiquidityParams params);

    /**
     * Pays out up to {@code params.max()} of the owed balance to {@code params.recipient()}.
     *
     * @param caller position owner
     * @param params collect parameters
     * @return amounts paid out
     */
    TokenAmounts collect(Address caller, CollectParams params);

    /**
     * Burns an emptied position.
     *
     * @param caller position owner
     * @param positionId position to burn
     * @throws IllegalStateException if liquidity or owed balance is non-zero
     */
    void burn(Address caller, PositionId positionId);

    /**
     * Reads the live position state.
     *
     * @param positionId position id
     * @return liquidity and owed-balance snapshot
     * @throws IllegalArgumentException if the position does not exist
     */
    PositionSnapshot positions(PositionId positionId);
}
