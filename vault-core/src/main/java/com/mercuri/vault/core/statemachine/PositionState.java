package com.mercuri.vault.core.statemachine;

import com.mercuri.vault.core.model.PositionId;

/**
 * Vault가 보유한 단일 포지션의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * EMPTY
 *    │
 *    ▼ (mint)
 * ACTIVE ──► ACTIVE (increase / decrease / collect)
 *    │
 *    ▼ (burn / close / withdrawAll)
 * EMPTY
 *
 * 금지된 전이:
 * - EMPTY → EMPTY (burn, close) ❌
 * - ACTIVE → ACTIVE (mint) ❌ : 두 개의 활성 포지션 불가
 * </pre>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public enum PositionState {

    /**
     * 활성 포지션 없음 (positionId == 0).
     */
    EMPTY,

    /**
     * 활성 포지션 보유 (positionId == 외부 엔진 ID).
     */
    ACTIVE;

    /**
     * positionId로부터 상태 도출.
     *
     * @param positionId 현재 positionId
     * @return NONE이면 EMPTY, 아니면 ACTIVE
     */
    public static PositionState of(PositionId positionId) {
        if (positionId == null) {
            throw new IllegalArgumentException("positionId cannot be null");
        }
        return positionId.isNone() ? EMPTY : ACTIVE;
    }
}
