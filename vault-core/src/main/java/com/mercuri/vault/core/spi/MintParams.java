package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.TickRange;
import com.mercuri.vault.core.model.TokenAmounts;

/**
 * Position mint parameters.
 *
 * <p>Tokens are carried as supplied by the caller; pool identity is validated by the vault,
 * not by this record.</p>
 *
 * @param token0 requested token0
 * @param token1 requested token1
 * @param fee requested fee tier
 * @param ticks price range
 * @param desired desired deposit amounts
 * @param min minimum deposit amounts (slippage floors)
 * @param recipient position recipient
 * @param deadline latest accepted execution time (epoch seconds)
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record MintParams(
    Address token0,
    Address token1,
    int fee,
    TickRange ticks,
    TokenAmounts desired,
    TokenAmounts min,
    Address recipient,
    long deadline
) {

    public MintParams {
        if (token0 == null || token1 == null || ticks == null || desired == null || min == null || recipient == null) {
            throw new IllegalArgumentException("mint parameters cannot be null");
        }
    }
}
