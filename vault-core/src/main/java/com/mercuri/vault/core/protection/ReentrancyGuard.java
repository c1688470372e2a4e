package com.mercuri.vault.core.protection;

import com.mercuri.vault.core.error.VaultException;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 단일 실행(single-flight) 보호.
 *
 * <p>하나의 Vault 인스턴스에 속한 모든 상태 변경 진입점이 이 guard 하나를 공유합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>같은 호출 트리(같은 스레드)에서의 중첩 진입: 상태 변경 전에 즉시 {@code REENTRANT} 실패.
 *       외부 엔진, 스왑 엔진, wrapped 자산 컨트랙트의 콜백을 통한 재진입도 여기에 해당합니다.</li>
 *   <li>다른 스레드의 진입: 실행 중인 작업이 끝날 때까지 대기 후 순차 실행.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ReentrancyGuard guard = new ReentrancyGuard();
 *
 * guard.execute("withdrawAll", () -> {
 *     // 이 블록 안에서 다시 guard.execute(...)를 호출하면 VaultException(REENTRANT)
 *     return doWithdraw();
 * });
 * }</pre>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public final class ReentrancyGuard {

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * 보호 구간 안에서 작업 실행.
     *
     * @param operation 작업 이름 (오류 메시지용)
     * @param body 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws VaultException REENTRANT - 같은 호출 트리에서 이미 보호 구간에 있는 경우
     */
    public <T> T execute(String operation, Supplier<T> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (lock.isHeldByCurrentThread()) {
            throw VaultException.reentrant("nested call to " + operation + " while another guarded operation is executing");
        }
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 결과 없는 작업 실행.
     *
     * @param operation 작업 이름
     * @param body 실행할 작업
     */
    public void run(String operation, Runnable body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        execute(operation, () -> {
            body.run();
            return null;
        });
    }
}
