package com.mercuri.vault.core.protection.noop;

import com.mercuri.vault.core.spi.StateJournal;

import java.util.concurrent.atomic.AtomicLong;

/**
 * StateJournal NoOp 구현.
 *
 * <p>체크포인트를 발급만 하고 외부 협력자 상태를 되돌리지 않습니다.
 * 협력자 자체가 트랜잭션 단위로 되돌려지는 환경(예: 온체인 실행)에서 사용합니다.
 * Vault 내부 상태의 롤백은 이 구현과 무관하게 항상 수행됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>checkpoint(): 증가하는 sequence 반환</li>
 *   <li>revertTo(): 아무 동작 안 함</li>
 *   <li>release(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public final class NoOpStateJournal implements StateJournal {

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Checkpoint checkpoint() {
        return new Checkpoint(sequence.incrementAndGet());
    }

    @Override
    public void revertTo(Checkpoint checkpoint) {
        // NoOp
    }

    @Override
    public void release(Checkpoint checkpoint) {
        // NoOp
    }
}
