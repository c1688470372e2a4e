package com.mercuri.vault.runtime;

import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.event.NativeWithdrawn;
import com.mercuri.vault.core.event.Withdrawn;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.statemachine.PositionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * 전체 출금 조정자 (Owner 전용 경로).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. ACTIVE이면 전체 해체 ({@link TeardownSequence})
 * 2. token0 잔고 → Owner
 * 3. token1 잔고 → Owner
 * </pre>
 *
 * <p><strong>토큰별 sweep:</strong></p>
 * <ul>
 *   <li>잔고 0: 전송 없음, 알림 없음</li>
 *   <li>wrapped 네이티브 + 언랩 설정: 언랩 후 네이티브 전송. 실패 시 작업 전체 TRANSFER_FAILURE</li>
 *   <li>그 외: 토큰 직접 전송</li>
 * </ul>
 *
 * <p>Manager가 접근할 수 있는 출금 경로는 어디에도 없습니다.</p>
 */
final class WithdrawalOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(WithdrawalOrchestrator.class);

    private final VaultBinding binding;
    private final VaultState state;
    private final PositionLifecycleController lifecycle;
    private final EventBuffer events;

    WithdrawalOrchestrator(VaultBinding binding, VaultState state, PositionLifecycleController lifecycle, EventBuffer events) {
        this.binding = binding;
        this.state = state;
        this.lifecycle = lifecycle;
        this.events = events;
    }

    void withdrawAll() {
        if (state.positionState() == PositionState.ACTIVE) {
            lifecycle.closeActive();
        }
        sweep(binding.token0());
        sweep(binding.token1());
        log.info("Withdrew all funds of {} to owner {}", binding.address(), binding.owner());
    }

    private void sweep(Address token) {
        BigInteger balance = binding.collaborators().tokens().balanceOf(token, binding.address());
        if (balance.signum() == 0) {
            return;
        }

        Address wrapped = binding.collaborators().wrappedNative().address();
        if (token.equals(wrapped) && state.unwrapNative()) {
            binding.collaborators().wrappedNative().withdraw(binding.address(), balance);
            if (!binding.collaborators().nativeCurrency().send(binding.address(), binding.owner(), balance)) {
                throw VaultException.transferFailure("native transfer of " + balance + " to owner " + binding.owner() + " failed");
            }
            events.emit(new NativeWithdrawn(binding.address(), binding.owner(), balance));
            return;
        }

        binding.collaborators().tokens().transfer(token, binding.address(), binding.owner(), balance);
        events.emit(new Withdrawn(binding.address(), token, binding.owner(), balance));
    }
}
