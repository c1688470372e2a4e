package com.mercuri.vault.runtime;

import com.mercuri.vault.core.ledger.FeeLedger;
import com.mercuri.vault.core.ledger.LedgerSnapshot;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.statemachine.PositionAction;
import com.mercuri.vault.core.statemachine.PositionState;
import com.mercuri.vault.core.statemachine.PositionTransition;

/**
 * Vault의 변경 가능한 상태.
 *
 * <p>Owner, 풀, 협력자 참조처럼 불변인 값은 여기에 두지 않습니다.
 * 모든 변경은 {@link AtomicExecution} 안에서만 일어나며, 실패 시 {@link #restore(Snapshot)}로 되돌립니다.</p>
 *
 * <p>작업 중의 값은 guard를 보유한 스레드만 봅니다. 외부 조회는 커밋 시점에
 * {@link #publish()}로 게시된 불변 스냅샷({@link #committed()})만 읽습니다.</p>
 */
final class VaultState {

    private Address manager;
    private PositionId positionId = PositionId.NONE;
    private boolean unwrapNative;
    private final FeeLedger ledger = new FeeLedger();
    private volatile Snapshot committed;

    VaultState(Address manager, boolean unwrapNative) {
        this.manager = manager;
        this.unwrapNative = unwrapNative;
        this.committed = snapshot();
    }

    Address manager() {
        return manager;
    }

    void setManager(Address manager) {
        this.manager = manager;
    }

    PositionId positionId() {
        return positionId;
    }

    PositionState positionState() {
        return PositionState.of(positionId);
    }

    void activate(PositionId positionId) {
        PositionTransition.transition(positionState(), PositionAction.MINT);
        if (positionId.isNone()) {
            throw new IllegalStateException("engine returned no position id");
        }
        this.positionId = positionId;
    }

    /**
     * 포지션 해제 (burn 또는 전체 해체 후).
     *
     * @param action {@link PositionAction#BURN} 또는 {@link PositionAction#CLOSE}
     */
    void clearPosition(PositionAction action) {
        if (PositionTransition.transition(positionState(), action) != PositionState.EMPTY) {
            throw new IllegalArgumentException(action + " does not release the position");
        }
        this.positionId = PositionId.NONE;
    }

    boolean unwrapNative() {
        return unwrapNative;
    }

    void setUnwrapNative(boolean unwrapNative) {
        this.unwrapNative = unwrapNative;
    }

    FeeLedger ledger() {
        return ledger;
    }

    Snapshot snapshot() {
        return new Snapshot(manager, positionId, unwrapNative, ledger.snapshot());
    }

    /**
     * 현재 값을 커밋된 상태로 게시.
     */
    void publish() {
        this.committed = snapshot();
    }

    /**
     * 마지막으로 커밋된 상태.
     */
    Snapshot committed() {
        return committed;
    }

    void restore(Snapshot snapshot) {
        this.manager = snapshot.manager();
        this.positionId = snapshot.positionId();
        this.unwrapNative = snapshot.unwrapNative();
        this.ledger.restore(snapshot.ledger());
    }

    record Snapshot(Address manager, PositionId positionId, boolean unwrapNative, LedgerSnapshot ledger) {

        PositionState positionState() {
            return PositionState.of(positionId);
        }
    }
}
