package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;

import java.math.BigInteger;

/**
 * Liquidity decrease parameters.
 *
 * @param positionId target position
 * @param liquidity liquidity to remove
 * @param min minimum principal amounts to release
 * @param deadline latest accepted execution time (epoch seconds)
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record DecreaseLiquidityParams(PositionId positionId, BigInteger liquidity, TokenAmounts min, long deadline) {

    public DecreaseLiquidityParams {
        if (positionId == null || min == null) {
            throw new IllegalArgumentException("decrease parameters cannot be null");
        }
        if (liquidity == null || liquidity.signum() < 0) {
            throw new IllegalArgumentException("liquidity must be non-negative (current: " + liquidity + ")");
        }
    }
}
