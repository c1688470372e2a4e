package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;

/**
 * 프로토콜 성과 수수료 설정.
 *
 * @param feeBps 수수료율 (basis points, 0~10000)
 * @param recipient 수수료 수령 주소 (feeBps가 0보다 크면 영 주소 불가)
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record ProtocolFees(int feeBps, Address recipient) {

    /**
     * basis points 분모.
     */
    public static final int BPS_DENOMINATOR = 10_000;

    public ProtocolFees {
        if (feeBps < 0 || feeBps > BPS_DENOMINATOR) {
            throw new IllegalArgumentException("feeBps must be between 0 and " + BPS_DENOMINATOR + " (current: " + feeBps + ")");
        }
        if (recipient == null) {
            throw new IllegalArgumentException("recipient cannot be null");
        }
        if (feeBps > 0 && recipient.isZero()) {
            throw new IllegalArgumentException("recipient cannot be the zero address when feeBps is positive");
        }
    }

    public static ProtocolFees none() {
        return new ProtocolFees(0, Address.ZERO);
    }
}
