package com.mercuri.vault.core.statemachine;

import com.mercuri.vault.core.error.VaultException;

/**
 * 포지션 상태 전이 검증.
 *
 * <p>각 {@link PositionAction}은 정해진 시작 상태에서만 허용됩니다.
 * 외부 엔진 호출 이전에 검증되어야 합니다.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public final class PositionTransition {

    // Utility class - prevent instantiation
    private PositionTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 동작이 현재 상태에서 허용되는지 검증.
     *
     * @param current 현재 상태
     * @param action 수행할 동작
     * @throws IllegalArgumentException current 또는 action이 null인 경우
     * @throws VaultException INVALID_STATE - 허용되지 않는 상태인 경우
     */
    public static void validate(PositionState current, PositionAction action) {
        if (current == null || action == null) {
            throw new IllegalArgumentException("State and action cannot be null (current: " + current + ", action: " + action + ")");
        }
        if (current != action.requiredState()) {
            throw VaultException.invalidState(
                String.format("%s requires %s position state (current: %s)", action, action.requiredState(), current)
            );
        }
    }

    /**
     * 검증 후 전이 결과 상태 반환.
     *
     * @param current 현재 상태
     * @param action 수행할 동작
     * @return 전이 후 상태
     */
    public static PositionState transition(PositionState current, PositionAction action) {
        validate(current, action);
        return action.resultState();
    }
}
