package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;

import java.math.BigInteger;

/**
 * Result of a position mint.
 *
 * @param positionId newly issued position id
 * @param liquidity liquidity minted
 * @param amounts amounts actually deposited
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record MintResult(PositionId positionId, BigInteger liquidity, TokenAmounts amounts) {

    public MintResult {
        if (positionId == null || positionId.isNone()) {
            throw new IllegalArgumentException("positionId must be a real position (current: " + positionId + ")");
        }
        if (liquidity == null || liquidity.signum() < 0) {
            throw new IllegalArgumentException("liquidity must be non-negative (current: " + liquidity + ")");
        }
        if (amounts == null) {
            throw new IllegalArgumentException("amounts cannot be null");
        }
    }
}
