package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.PoolKey;
import com.mercuri.vault.core.model.TickRange;
import com.mercuri.vault.core.model.TokenAmounts;

import java.math.BigInteger;

/**
 * Live view of a position held by the liquidity engine.
 *
 * @param poolKey pool the position belongs to
 * @param ticks price range
 * @param liquidity current liquidity
 * @param tokensOwed owed balance (collectable without touching liquidity)
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record PositionSnapshot(PoolKey poolKey, TickRange ticks, BigInteger liquidity, TokenAmounts tokensOwed) {

    public PositionSnapshot {
        if (poolKey == null || ticks == null || liquidity == null || tokensOwed == null) {
            throw new IllegalArgumentException("position snapshot fields cannot be null");
        }
    }

    public boolean hasLiquidity() {
        return liquidity.signum() > 0;
    }
}
