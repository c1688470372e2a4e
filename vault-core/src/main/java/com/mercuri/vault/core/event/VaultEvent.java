package com.mercuri.vault.core.event;

import com.mercuri.vault.core.model.Address;

/**
 * Vault 알림.
 *
 * <p>Sealed interface로 정의되어 모든 알림 종류가 컴파일 타임에 고정됩니다.</p>
 * <ul>
 *   <li>{@link ManagerChanged}: Manager 변경</li>
 *   <li>{@link Deposited}: Owner 입금</li>
 *   <li>{@link Withdrawn}: 토큰 출금</li>
 *   <li>{@link NativeWithdrawn}: 네이티브 자산 출금</li>
 *   <li>{@link PositionClosed}: 포지션 종료</li>
 *   <li>{@link PerformanceFeeTaken}: 성과 수수료 징수</li>
 * </ul>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public sealed interface VaultEvent
    permits ManagerChanged, Deposited, Withdrawn, NativeWithdrawn, PositionClosed, PerformanceFeeTaken {

    /**
     * 알림을 발생시킨 Vault.
     *
     * @return Vault 주소
     */
    Address vault();
}
