package com.mercuri.vault.core.statemachine;

/**
 * 포지션 생명주기 동작.
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public enum PositionAction {

    MINT(PositionState.EMPTY, PositionState.ACTIVE),
    INCREASE(PositionState.ACTIVE, PositionState.ACTIVE),
    DECREASE(PositionState.ACTIVE, PositionState.ACTIVE),
    COLLECT(PositionState.ACTIVE, PositionState.ACTIVE),
    BURN(PositionState.ACTIVE, PositionState.EMPTY),
    CLOSE(PositionState.ACTIVE, PositionState.EMPTY);

    private final PositionState requiredState;
    private final PositionState resultState;

    PositionAction(PositionState requiredState, PositionState resultState) {
        this.requiredState = requiredState;
        this.resultState = resultState;
    }

    public PositionState requiredState() {
        return requiredState;
    }

    public PositionState resultState() {
        return resultState;
    }
}
