package com.mercuri.vault.core.ledger;

import com.mercuri.vault.core.model.TokenAmounts;
import com.mercuri.vault.core.spi.ProtocolFees;

import java.math.BigInteger;

/**
 * 성과 수수료 계산.
 *
 * <p>{@code fee = floor(base * feeBps / 10000)} (토큰별). 결과는 항상 base 이하입니다.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public final class PerformanceFee {

    private static final BigInteger DENOMINATOR = BigInteger.valueOf(ProtocolFees.BPS_DENOMINATOR);

    // Utility class - prevent instantiation
    private PerformanceFee() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 토큰별 수수료 계산.
     *
     * @param feeBase 수수료 산정 기준 (스왑 수수료 수입)
     * @param feeBps 수수료율 (0~10000)
     * @return 토큰별 수수료
     * @throws IllegalArgumentException feeBase가 null이거나 feeBps가 범위를 벗어난 경우
     */
    public static TokenAmounts compute(TokenAmounts feeBase, int feeBps) {
        if (feeBase == null) {
            throw new IllegalArgumentException("feeBase cannot be null");
        }
        if (feeBps < 0 || feeBps > ProtocolFees.BPS_DENOMINATOR) {
            throw new IllegalArgumentException("feeBps must be between 0 and " + ProtocolFees.BPS_DENOMINATOR + " (current: " + feeBps + ")");
        }
        BigInteger bps = BigInteger.valueOf(feeBps);
        return new TokenAmounts(
            feeBase.amount0().multiply(bps).divide(DENOMINATOR),
            feeBase.amount1().multiply(bps).divide(DENOMINATOR)
        );
    }
}
