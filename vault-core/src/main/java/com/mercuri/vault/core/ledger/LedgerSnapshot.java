package com.mercuri.vault.core.ledger;

import com.mercuri.vault.core.model.TokenAmounts;

/**
 * FeeLedger 시점 값 (롤백용).
 *
 * @param accruedFees 수수료 미적용 스왑 수입
 * @param owedPrincipal 엔진 미수령 잔고에 옮겨진 원금
 */
public record LedgerSnapshot(TokenAmounts accruedFees, TokenAmounts owedPrincipal) {

    public LedgerSnapshot {
        if (accruedFees == null || owedPrincipal == null) {
            throw new IllegalArgumentException("ledger snapshot fields cannot be null");
        }
    }
}
