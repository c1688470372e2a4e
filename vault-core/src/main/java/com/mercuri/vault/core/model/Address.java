package com.mercuri.vault.core.model;

import java.util.Locale;

/**
 * 계정 식별자 (20바이트 주소).
 *
 * <p>Vault, Owner, Manager, 토큰, 외부 컨트랙트 모두 Address로 식별됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>패턴: {@code 0x} 접두사 + 16진수 40자</li>
 *   <li>대소문자 구분 없음 (소문자로 정규화)</li>
 * </ul>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public final class Address {

    /**
     * 영 주소 (미설정 / 해제 표시).
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    private final String value;

    private Address(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Address cannot be null or blank");
        }
        if (!value.matches("^0[xX][0-9a-fA-F]{40}$")) {
            throw new IllegalArgumentException("Address must be 0x followed by 40 hex characters (current: " + value + ")");
        }
        this.value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Address 생성.
     *
     * @param value 16진수 주소 문자열
     * @return Address 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Address of(String value) {
        return new Address(value);
    }

    /**
     * 정수 값으로부터 Address 생성 (테스트 및 결정적 주소 할당용).
     *
     * @param value 0 이상의 정수
     * @return 하위 바이트에 value가 채워진 Address
     */
    public static Address fromLong(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("value must be non-negative (current: " + value + ")");
        }
        return new Address(String.format("0x%040x", value));
    }

    public String getValue() {
        return value;
    }

    public boolean isZero() {
        return this.equals(ZERO);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Address address = (Address) o;
        return value.equals(address.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
