package com.mercuri.vault.runtime;

import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.protection.noop.NoOpStateJournal;
import com.mercuri.vault.core.spi.LiquidityEngine;
import com.mercuri.vault.core.spi.ManagerRegistry;
import com.mercuri.vault.core.spi.NativeCurrency;
import com.mercuri.vault.core.spi.PoolDirectory;
import com.mercuri.vault.core.spi.ProtocolFeeSource;
import com.mercuri.vault.core.spi.StateJournal;
import com.mercuri.vault.core.spi.SwapEngine;
import com.mercuri.vault.core.spi.TokenLedger;
import com.mercuri.vault.core.spi.VaultEventListener;
import com.mercuri.vault.core.spi.WrappedNativeAsset;

import java.time.Clock;

/**
 * Vault가 사용하는 외부 협력자 묶음.
 *
 * <p>모든 참조는 생성 후 변경되지 않습니다. 레지스트리와 수수료 설정은 참조만 고정되고,
 * 값은 매 사용 시점에 새로 조회됩니다.</p>
 *
 * @param liquidityEngine 포지션 매니저
 * @param swapEngine 스왑 라우터
 * @param registry Manager 레지스트리
 * @param feeSource 프로토콜 수수료 설정
 * @param wrappedNative wrapped 네이티브 자산
 * @param tokens 토큰 장부
 * @param nativeCurrency 네이티브 자산 전송
 * @param pools 풀 조회
 * @param listener 알림 수신자 (null이면 버림)
 * @param journal 협력자 상태 저널 (null이면 {@link NoOpStateJournal})
 * @param clock 마감 시각 계산용 시계 (null이면 UTC 시스템 시계)
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record VaultCollaborators(
    LiquidityEngine liquidityEngine,
    SwapEngine swapEngine,
    ManagerRegistry registry,
    ProtocolFeeSource feeSource,
    WrappedNativeAsset wrappedNative,
    TokenLedger tokens,
    NativeCurrency nativeCurrency,
    PoolDirectory pools,
    VaultEventListener listener,
    StateJournal journal,
    Clock clock
) {

    /**
     * Compact constructor.
     *
     * @throws VaultException CONFIGURATION_ERROR - 필수 협력자가 null인 경우
     */
    public VaultCollaborators {
        requireNonNull(liquidityEngine, "liquidityEngine");
        requireNonNull(swapEngine, "swapEngine");
        requireNonNull(registry, "registry");
        requireNonNull(feeSource, "feeSource");
        requireNonNull(wrappedNative, "wrappedNative");
        requireNonNull(tokens, "tokens");
        requireNonNull(nativeCurrency, "nativeCurrency");
        requireNonNull(pools, "pools");
        if (listener == null) {
            listener = event -> { };
        }
        if (journal == null) {
            journal = new NoOpStateJournal();
        }
        if (clock == null) {
            clock = Clock.systemUTC();
        }
    }

    /**
     * listener만 변경한 새 인스턴스 생성.
     */
    public VaultCollaborators withListener(VaultEventListener listener) {
        return new VaultCollaborators(liquidityEngine, swapEngine, registry, feeSource, wrappedNative,
            tokens, nativeCurrency, pools, listener, journal, clock);
    }

    /**
     * journal만 변경한 새 인스턴스 생성.
     */
    public VaultCollaborators withJournal(StateJournal journal) {
        return new VaultCollaborators(liquidityEngine, swapEngine, registry, feeSource, wrappedNative,
            tokens, nativeCurrency, pools, listener, journal, clock);
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw VaultException.configuration(name + " cannot be null");
        }
    }
}
