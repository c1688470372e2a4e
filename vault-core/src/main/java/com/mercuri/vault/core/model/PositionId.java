package com.mercuri.vault.core.model;

import java.math.BigInteger;

/**
 * 외부 유동성 엔진이 발급한 포지션 식별자.
 *
 * <p>{@link #NONE}(0)은 "활성 포지션 없음"을 의미합니다.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public final class PositionId {

    public static final PositionId NONE = new PositionId(BigInteger.ZERO);

    private final BigInteger value;

    private PositionId(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("PositionId cannot be null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("PositionId must be non-negative (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * PositionId 생성.
     *
     * @param value 포지션 번호 (0 이상)
     * @return PositionId 인스턴스 (0이면 {@link #NONE})
     * @throws IllegalArgumentException value가 null이거나 음수인 경우
     */
    public static PositionId of(BigInteger value) {
        if (value != null && value.signum() == 0) {
            return NONE;
        }
        return new PositionId(value);
    }

    public static PositionId of(long value) {
        return of(BigInteger.valueOf(value));
    }

    public BigInteger getValue() {
        return value;
    }

    public boolean isNone() {
        return value.signum() == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PositionId that = (PositionId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "PositionId{" + value + '}';
    }
}
