package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;

import java.math.BigInteger;

/**
 * Owed-balance collect parameters.
 *
 * @param positionId target position
 * @param recipient account receiving the collected tokens
 * @param max per-token upper bound of the payout
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record CollectParams(PositionId positionId, Address recipient, TokenAmounts max) {

    /**
     * Largest collectable amount per token (uint128 max).
     */
    public static final BigInteger MAX_AMOUNT = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);

    public CollectParams {
        if (positionId == null || recipient == null || max == null) {
            throw new IllegalArgumentException("collect parameters cannot be null");
        }
    }

    /**
     * Collects everything owed.
     */
    public static CollectParams all(PositionId positionId, Address recipient) {
        return new CollectParams(positionId, recipient, new TokenAmounts(MAX_AMOUNT, MAX_AMOUNT));
    }
}
