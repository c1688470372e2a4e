package com.mercuri.vault.application.vault;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PoolKey;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;
import com.mercuri.vault.core.statemachine.PositionState;

/**
 * Vault 영속 상태의 불변 사본.
 *
 * @param address Vault 주소
 * @param owner Owner (불변)
 * @param manager 현재 Manager
 * @param pool 바인딩된 풀
 * @param poolKey 풀의 토큰 쌍과 수수료 등급
 * @param positionId 현재 포지션 ({@link PositionId#NONE}이면 없음)
 * @param accruedFees 수수료 미적용 수입 (최상위 작업 사이에는 항상 0)
 * @param owedPrincipal 부분 decrease로 엔진에 남아있는 원금
 * @param unwrapNative 출금 시 언랩 여부
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record VaultSnapshot(
    Address address,
    Address owner,
    Address manager,
    Address pool,
    PoolKey poolKey,
    PositionId positionId,
    TokenAmounts accruedFees,
    TokenAmounts owedPrincipal,
    boolean unwrapNative
) {

    public PositionState state() {
        return PositionState.of(positionId);
    }
}
