package com.mercuri.vault.runtime;

import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.protection.ReentrancyGuard;
import com.mercuri.vault.core.spi.StateJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 상태 변경 작업의 원자적 실행.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. ReentrancyGuard 진입 (중첩 진입이면 즉시 REENTRANT, 상태 미변경)
 * 2. Vault 상태 스냅샷 + StateJournal 체크포인트
 * 3. 작업 실행
 * 4-a. 성공: 장부 불변식 확인 → 상태 게시 → 체크포인트 해제 → 알림 전달
 * 4-b. 실패: Vault 상태 복원 → 체크포인트로 되돌림 → 알림 폐기 → 예외 재전파
 * </pre>
 *
 * <p>부분 커밋, 로컬 복구, 자동 재시도는 없습니다. 협력자 예외는 감싸지 않고 같은 인스턴스로 재전파합니다.</p>
 */
final class AtomicExecution {

    private static final Logger log = LoggerFactory.getLogger(AtomicExecution.class);

    private final ReentrancyGuard guard;
    private final VaultState state;
    private final StateJournal journal;
    private final EventBuffer events;

    AtomicExecution(ReentrancyGuard guard, VaultState state, StateJournal journal, EventBuffer events) {
        this.guard = guard;
        this.state = state;
        this.journal = journal;
        this.events = events;
    }

    <T> T execute(String operation, Supplier<T> body) {
        return guard.execute(operation, () -> {
            VaultState.Snapshot before = state.snapshot();
            StateJournal.Checkpoint checkpoint = journal.checkpoint();
            try {
                T result = body.get();
                if (!state.ledger().accruedFees().isZero()) {
                    throw new IllegalStateException(
                        operation + " left untaxed income in the ledger: " + state.ledger().accruedFees()
                    );
                }
                state.publish();
                journal.release(checkpoint);
                events.flush();
                return result;
            } catch (RuntimeException e) {
                state.restore(before);
                journal.revertTo(checkpoint);
                events.discard();
                logFailure(operation, e);
                throw e;
            }
        });
    }

    void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    private void logFailure(String operation, RuntimeException e) {
        if (e instanceof VaultException) {
            log.warn("{} reverted: {}", operation, e.getMessage());
        } else {
            log.error("{} reverted by collaborator failure", operation, e);
        }
    }
}
