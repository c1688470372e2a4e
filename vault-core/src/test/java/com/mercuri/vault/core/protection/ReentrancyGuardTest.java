package com.mercuri.vault.core.protection;

import com.mercuri.vault.core.error.VaultErrorCode;
import com.mercuri.vault.core.error.VaultException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * ReentrancyGuard 테스트.
 *
 * <ul>
 *   <li>같은 호출 트리 안의 중첩 호출은 REENTRANT 로 거부</li>
 *   <li>다른 스레드는 실행 중인 작업이 끝날 때까지 대기</li>
 *   <li>예외 후에도 가드는 해제됨</li>
 * </ul>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
class ReentrancyGuardTest {

    private final ReentrancyGuard guard = new ReentrancyGuard();

    @Test
    void execute_결과_반환() {
        assertThat(guard.execute("op", () -> 42)).isEqualTo(42);
    }

    @Test
    void execute_중첩_호출은_REENTRANT() {
        AtomicInteger innerRuns = new AtomicInteger();

        VaultException exception = catchThrowableOfType(
            () -> guard.run("outer", () -> guard.run("inner", innerRuns::incrementAndGet)),
            VaultException.class);

        assertThat(exception.getErrorCode()).isEqualTo(VaultErrorCode.REENTRANT);
        assertThat(exception).hasMessageContaining("inner");

        assertThat(innerRuns).hasValue(0);
        assertThat(guard.execute("after", () -> true)).isTrue();
    }

    @Test
    void execute_예외_후_가드_해제() {
        assertThatThrownBy(() -> guard.run("failing", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(guard.execute("next", () -> "ok")).isEqualTo("ok");
    }

    @Test
    void execute_다른_스레드는_대기_후_실행() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger order = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<?> first = executor.submit(() -> guard.run("first", () -> {
                entered.countDown();
                awaitQuietly(release);
                order.compareAndSet(0, 1);
            }));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            Future<Integer> second = executor.submit(() -> guard.execute("second", () -> order.compareAndSet(1, 2) ? 2 : -1));
            Thread.sleep(50);
            assertThat(second.isDone()).isFalse();

            release.countDown();
            first.get(5, TimeUnit.SECONDS);
            assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo(2);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
