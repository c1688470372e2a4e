package com.mercuri.vault.core.model;

/**
 * 풀의 정렬된 토큰 쌍.
 *
 * <p>token0은 항상 token1보다 작은 주소입니다 (풀 정렬 규칙).</p>
 *
 * @param token0 작은 주소의 토큰
 * @param token1 큰 주소의 토큰
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record TokenPair(Address token0, Address token1) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException null, 영 주소, 동일 토큰, 정렬 위반인 경우
     */
    public TokenPair {
        if (token0 == null || token1 == null) {
            throw new IllegalArgumentException("tokens cannot be null (token0: " + token0 + ", token1: " + token1 + ")");
        }
        if (token0.isZero() || token1.isZero()) {
            throw new IllegalArgumentException("tokens cannot be the zero address");
        }
        if (token0.getValue().compareTo(token1.getValue()) >= 0) {
            throw new IllegalArgumentException(
                String.format("token0 must sort before token1 (token0: %s, token1: %s)", token0, token1)
            );
        }
    }

    /**
     * 두 토큰을 정렬하여 TokenPair 생성.
     *
     * @param a 토큰 A
     * @param b 토큰 B
     * @return 정렬된 TokenPair
     */
    public static TokenPair sorted(Address a, Address b) {
        if (a != null && b != null && a.getValue().compareTo(b.getValue()) > 0) {
            return new TokenPair(b, a);
        }
        return new TokenPair(a, b);
    }

    public boolean contains(Address token) {
        return token0.equals(token) || token1.equals(token);
    }

    /**
     * 두 토큰이 이 쌍의 서로 다른 두 토큰인지 확인 (순서 무관).
     */
    public boolean isPairOf(Address a, Address b) {
        return (token0.equals(a) && token1.equals(b)) || (token0.equals(b) && token1.equals(a));
    }
}
