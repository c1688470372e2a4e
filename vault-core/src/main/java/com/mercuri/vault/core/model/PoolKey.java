package com.mercuri.vault.core.model;

/**
 * 풀 식별 키 (토큰 쌍 + 수수료 등급).
 *
 * @param pair 정렬된 토큰 쌍
 * @param fee 수수료 등급 (백만분율, 예: 500 = 0.05%)
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record PoolKey(TokenPair pair, int fee) {

    public PoolKey {
        if (pair == null) {
            throw new IllegalArgumentException("pair cannot be null");
        }
        if (fee <= 0 || fee >= 1_000_000) {
            throw new IllegalArgumentException("fee must be between 1 and 999999 (current: " + fee + ")");
        }
    }

    public Address token0() {
        return pair.token0();
    }

    public Address token1() {
        return pair.token1();
    }
}
