package com.mercuri.vault.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TokenAmounts / TokenPair / PositionId 값 객체 테스트.
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
class TokenAmountsTest {

    @Test
    void saturatingMinus_음수는_0으로_고정() {
        TokenAmounts result = TokenAmounts.of(10, 3).saturatingMinus(TokenAmounts.of(4, 5));

        assertEquals(TokenAmounts.of(6, 0), result);
    }

    @Test
    void plus_와_min() {
        assertEquals(TokenAmounts.of(3, 7), TokenAmounts.of(1, 2).plus(TokenAmounts.of(2, 5)));
        assertEquals(TokenAmounts.of(1, 2), TokenAmounts.of(1, 9).min(TokenAmounts.of(4, 2)));
    }

    @Test
    void 음수_금액은_예외() {
        assertThrows(IllegalArgumentException.class, () -> new TokenAmounts(BigInteger.valueOf(-1), BigInteger.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new TokenAmounts(null, BigInteger.ZERO));
    }

    @Test
    void isZero() {
        assertTrue(TokenAmounts.ZERO.isZero());
        assertFalse(TokenAmounts.of(0, 1).isZero());
    }

    @Test
    void tokenPair_sorted_순서_정렬() {
        Address a = Address.fromLong(2);
        Address b = Address.fromLong(1);

        TokenPair pair = TokenPair.sorted(a, b);

        assertEquals(b, pair.token0());
        assertEquals(a, pair.token1());
        assertTrue(pair.isPairOf(a, b));
        assertTrue(pair.isPairOf(b, a));
        assertFalse(pair.isPairOf(a, a));
        assertTrue(pair.contains(a));
        assertFalse(pair.contains(Address.fromLong(3)));
    }

    @Test
    void tokenPair_역순_또는_동일_토큰은_예외() {
        Address a = Address.fromLong(1);
        Address b = Address.fromLong(2);

        assertThrows(IllegalArgumentException.class, () -> new TokenPair(b, a));
        assertThrows(IllegalArgumentException.class, () -> new TokenPair(a, a));
        assertThrows(IllegalArgumentException.class, () -> new TokenPair(Address.ZERO, a));
    }

    @Test
    void poolKey_수수료_등급_범위() {
        TokenPair pair = new TokenPair(Address.fromLong(1), Address.fromLong(2));

        assertThrows(IllegalArgumentException.class, () -> new PoolKey(pair, 0));
        assertThrows(IllegalArgumentException.class, () -> new PoolKey(pair, 1_000_000));
        assertEquals(3_000, new PoolKey(pair, 3_000).fee());
    }

    @Test
    void positionId_0은_NONE() {
        assertSame(PositionId.NONE, PositionId.of(0));
        assertTrue(PositionId.of(BigInteger.ZERO).isNone());
        assertFalse(PositionId.of(7).isNone());
        assertThrows(IllegalArgumentException.class, () -> PositionId.of(-1));
    }
}
