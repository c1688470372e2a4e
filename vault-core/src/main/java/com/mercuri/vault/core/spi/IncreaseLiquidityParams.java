package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;

/**
 * Liquidity increase parameters.
 *
 * @param positionId target position
 * @param desired desired deposit amounts
 * @param min minimum deposit amounts
 * @param deadline latest accepted execution time (epoch seconds)
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record IncreaseLiquidityParams(PositionId positionId, TokenAmounts desired, TokenAmounts min, long deadline) {

    public IncreaseLiquidityParams {
        if (positionId == null || desired == null || min == null) {
            throw new IllegalArgumentException("increase parameters cannot be null");
        }
    }
}
