package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;

import java.math.BigInteger;

/**
 * Single-hop exact-input swap parameters.
 *
 * @param tokenIn token sold
 * @param tokenOut token bought
 * @param fee pool fee tier routed through
 * @param recipient account receiving tokenOut
 * @param amountIn exact input amount
 * @param amountOutMinimum minimum output amount
 * @param sqrtPriceLimitX96 price limit (0 = none)
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record ExactInputSingleParams(
    Address tokenIn,
    Address tokenOut,
    int fee,
    Address recipient,
    BigInteger amountIn,
    BigInteger amountOutMinimum,
    BigInteger sqrtPriceLimitX96
) {

    public ExactInputSingleParams {
        if (tokenIn == null || tokenOut == null || recipient == null) {
            throw new IllegalArgumentException("swap addresses cannot be null");
        }
        if (amountIn == null || amountIn.signum() < 0) {
            throw new IllegalArgumentException("amountIn must be non-negative (current: " + amountIn + ")");
        }
        if (amountOutMinimum == null || amountOutMinimum.signum() < 0) {
            throw new IllegalArgumentException("amountOutMinimum must be non-negative (current: " + amountOutMinimum + ")");
        }
        if (sqrtPriceLimitX96 == null) {
            sqrtPriceLimitX96 = BigInteger.ZERO;
        }
    }
}
