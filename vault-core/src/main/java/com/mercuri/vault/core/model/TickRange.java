package com.mercuri.vault.core.model;

/**
 * 포지션의 가격 구간 (tick 단위).
 *
 * @param lower 하한 tick
 * @param upper 상한 tick (lower보다 커야 함)
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record TickRange(int lower, int upper) {

    public TickRange {
        if (lower >= upper) {
            throw new IllegalArgumentException("lower tick must be below upper tick (lower: " + lower + ", upper: " + upper + ")");
        }
    }
}
