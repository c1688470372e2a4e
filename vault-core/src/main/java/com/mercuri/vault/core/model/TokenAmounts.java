package com.mercuri.vault.core.model;

import java.math.BigInteger;

/**
 * token0 / token1 수량 쌍.
 *
 * <p>모든 수량은 최소 단위 정수이며 음수일 수 없습니다.</p>
 *
 * @param amount0 token0 수량
 * @param amount1 token1 수량
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record TokenAmounts(BigInteger amount0, BigInteger amount1) {

    public static final TokenAmounts ZERO = new TokenAmounts(BigInteger.ZERO, BigInteger.ZERO);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 수량이 null이거나 음수인 경우
     */
    public TokenAmounts {
        if (amount0 == null || amount1 == null) {
            throw new IllegalArgumentException("amounts cannot be null (amount0: " + amount0 + ", amount1: " + amount1 + ")");
        }
        if (amount0.signum() < 0 || amount1.signum() < 0) {
            throw new IllegalArgumentException("amounts must be non-negative (amount0: " + amount0 + ", amount1: " + amount1 + ")");
        }
    }

    public static TokenAmounts of(long amount0, long amount1) {
        return new TokenAmounts(BigInteger.valueOf(amount0), BigInteger.valueOf(amount1));
    }

    public TokenAmounts plus(TokenAmounts other) {
        return new TokenAmounts(amount0.add(other.amount0), amount1.add(other.amount1));
    }

    /**
     * 음수가 되지 않도록 0에서 잘라낸 차감.
     *
     * @param other 차감할 수량
     * @return 각 토큰별 {@code max(this - other, 0)}
     */
    public TokenAmounts saturatingMinus(TokenAmounts other) {
        return new TokenAmounts(
            amount0.subtract(other.amount0).max(BigInteger.ZERO),
            amount1.subtract(other.amount1).max(BigInteger.ZERO)
        );
    }

    /**
     * 각 토큰별 최솟값.
     */
    public TokenAmounts min(TokenAmounts other) {
        return new TokenAmounts(amount0.min(other.amount0), amount1.min(other.amount1));
    }

    public boolean isZero() {
        return amount0.signum() == 0 && amount1.signum() == 0;
    }
}
