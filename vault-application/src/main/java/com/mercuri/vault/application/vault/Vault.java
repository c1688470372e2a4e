package com.mercuri.vault.application.vault;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PoolKey;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;
import com.mercuri.vault.core.spi.CollectParams;
import com.mercuri.vault.core.spi.DecreaseLiquidityParams;
import com.mercuri.vault.core.spi.ExactInputSingleParams;
import com.mercuri.vault.core.spi.IncreaseLiquidityParams;
import com.mercuri.vault.core.spi.MintParams;
import com.mercuri.vault.core.spi.MintResult;
import com.mercuri.vault.core.spi.NativeReceiver;
import com.mercuri.vault.core.statemachine.PositionState;

import java.math.BigInteger;

/**
 * 단일 집중 유동성 포지션을 보관·운영하는 비수탁 Vault.
 *
 * <p>모든 상태 변경 작업은 다음 순서로 진입합니다:</p>
 * <ol>
 *   <li>Reentrancy Guard (중첩 진입 거부)</li>
 *   <li>Authorization Gate (Owner / Manager / 거부)</li>
 *   <li>작업별 검증 (상태, 포지션 ID, 토큰 쌍, 수신자)</li>
 *   <li>외부 엔진 호출</li>
 *   <li>장부 / 상태 갱신</li>
 *   <li>알림 발행</li>
 * </ol>
 *
 * <p>어느 단계에서든 실패하면 작업 전체가 되돌려지고 예외가 호출자에게 전달됩니다.</p>
 * <ul>
 *   <li>Vault 자신의 거부: {@link com.mercuri.vault.core.error.VaultException} + {@code VaultErrorCode}</li>
 *   <li>외부 협력자의 거부 (엔진 deadline, burn 조건 등): 협력자가 던진 예외 그대로 전달.
 *       Vault 코드가 없는 예외는 곧 외부 협력자 실패를 뜻합니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * MintResult minted = vault.mint(manager, mintParams);
 * vault.closePosition(manager, minted.positionId());
 * vault.withdrawAll(owner);
 * </pre>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public interface Vault extends NativeReceiver {

    // ========== 위임 가능 작업 (Owner / 승인된 Manager) ==========

    /**
     * 새 포지션 발행 (EMPTY 상태에서만).
     *
     * <p>요청 토큰 쌍과 수수료 등급은 Vault의 풀과 같아야 하며, 수신자는 Vault 자신,
     * 두 최소 수령량은 모두 0보다 커야 합니다.</p>
     *
     * @param caller 호출자
     * @param params 발행 파라미터
     * @return 발행 결과
     */
    MintResult mint(Address caller, MintParams params);

    /**
     * 현재 포지션에 유동성 추가.
     *
     * @param caller 호출자
     * @param params 추가 파라미터 (positionId는 현재 포지션과 같아야 함)
     * @return 실제 추가된 수량
     */
    TokenAmounts increaseLiquidity(Address caller, IncreaseLiquidityParams params);

    /**
     * 현재 포지션에서 일부 유동성 제거.
     *
     * <p>해체 순서를 실행하지 않습니다. 방출된 원금은 엔진의 미수령 잔고에 남고
     * 장부에 원금으로 기록됩니다.</p>
     *
     * @param caller 호출자
     * @param params 제거 파라미터
     * @return 미수령 잔고로 옮겨진 원금
     */
    TokenAmounts decreaseLiquidity(Address caller, DecreaseLiquidityParams params);

    /**
     * 미수령 잔고 회수 및 성과 수수료 적용.
     *
     * @param caller 호출자
     * @param params 회수 파라미터 (수신자는 Vault 자신)
     * @return 회수된 총 수량 (수수료 차감 전)
     */
    TokenAmounts collect(Address caller, CollectParams params);

    /**
     * 비워진 포지션 소각.
     *
     * @param caller 호출자
     * @param positionId 현재 포지션 ID
     */
    void burn(Address caller, PositionId positionId);

    /**
     * 전체 해체 후 포지션 종료. 자금은 Vault에 남습니다.
     *
     * @param caller 호출자
     * @param positionId 현재 포지션 ID
     * @return 회수된 원금
     */
    TokenAmounts closePosition(Address caller, PositionId positionId);

    /**
     * Vault의 두 토큰 사이 스왑.
     *
     * @param caller 호출자
     * @param params 스왑 파라미터 (수신자는 Vault 자신)
     * @return 받은 tokenOut 수량
     */
    BigInteger rebalance(Address caller, ExactInputSingleParams params);

    // ========== Owner 전용 작업 ==========

    /**
     * 활성 포지션이 있으면 해체하고, 두 토큰 잔고 전부를 Owner에게 전송.
     *
     * @param caller 호출자 (Owner만 허용)
     */
    void withdrawAll(Address caller);

    /**
     * Owner의 토큰을 Vault로 입금 (Owner의 사전 승인 필요).
     *
     * @param caller 호출자 (Owner만 허용)
     * @param token token0 또는 token1
     * @param amount 입금 수량
     */
    void deposit(Address caller, Address token, BigInteger amount);

    /**
     * Manager 변경.
     *
     * @param caller 호출자 (Owner만 허용)
     * @param newManager 새 Manager ({@link Address#ZERO}이면 위임 해제)
     */
    void setManager(Address caller, Address newManager);

    /**
     * wrapped 네이티브 자산 출금 시 언랩 여부 설정.
     *
     * @param caller 호출자 (Owner만 허용)
     * @param unwrapNative 언랩 여부
     */
    void setUnwrapNative(Address caller, boolean unwrapNative);

    // ========== 조회 ==========

    Address address();

    Address owner();

    Address manager();

    Address pool();

    PoolKey poolKey();

    PositionId positionId();

    PositionState state();

    boolean unwrapNative();

    /**
     * 영속 상태 스냅샷.
     *
     * @return 현재 상태의 불변 사본
     */
    VaultSnapshot snapshot();
}
