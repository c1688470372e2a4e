package com.mercuri.vault.runtime;

import com.mercuri.vault.core.event.PerformanceFeeTaken;
import com.mercuri.vault.core.ledger.FeeLedger;
import com.mercuri.vault.core.ledger.PerformanceFee;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;
import com.mercuri.vault.core.spi.CollectParams;
import com.mercuri.vault.core.spi.DecreaseLiquidityParams;
import com.mercuri.vault.core.spi.LiquidityEngine;
import com.mercuri.vault.core.spi.PositionSnapshot;
import com.mercuri.vault.core.spi.ProtocolFees;
import com.mercuri.vault.core.spi.TokenLedger;
import com.mercuri.vault.core.statemachine.PositionAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * 수수료/원금 분리 해체 순서.
 *
 * <p>전체 해체(withdrawAll, closePosition)는 반드시 아래 네 단계를 이 순서대로 실행합니다.
 * 단계를 합치거나 순서를 바꾸면 원금이 수수료 기준에 섞이거나(3 → 1) 수수료가 우회됩니다(2를 3/4 뒤로).</p>
 *
 * <ol>
 *   <li><strong>collect-while-active:</strong> 유동성이 남아있는 동안 회수. 수령액은 스왑 수수료 수입입니다.
 *       직전 관측 유동성이 0보다 클 때만 장부에 적립합니다.</li>
 *   <li><strong>성과 수수료 적용:</strong> 수수료 설정을 실시간 조회하여 {@code floor(base * bps / 10000)}를
 *       수령자에게 전송하고 장부를 0으로 만듭니다.</li>
 *   <li><strong>전체 유동성 제거:</strong> 최소 수령량 없이 100% 제거. 비상 출구가 항상 성공하도록
 *       슬리피지 보호를 두지 않습니다.</li>
 *   <li><strong>collect-after-teardown:</strong> 원금 회수. 수수료를 적용하지 않습니다.</li>
 * </ol>
 *
 * <p>해체 후 포지션을 소각하고 positionId를 NONE으로 되돌립니다.</p>
 */
final class TeardownSequence {

    private static final Logger log = LoggerFactory.getLogger(TeardownSequence.class);

    private final VaultBinding binding;
    private final VaultState state;
    private final EventBuffer events;

    TeardownSequence(VaultBinding binding, VaultState state, EventBuffer events) {
        this.binding = binding;
        this.state = state;
        this.events = events;
    }

    /**
     * 전체 해체 실행.
     *
     * @param positionId 해체할 포지션 (Vault의 현재 포지션)
     * @return 수수료 미적용 원금 회수액
     */
    TokenAmounts run(PositionId positionId) {
        LiquidityEngine engine = binding.collaborators().liquidityEngine();
        FeeLedger ledger = state.ledger();

        // 1. collect-while-active
        TokenAmounts earned = collectIncome(CollectParams.all(positionId, binding.address()));

        // 2. 성과 수수료 적용
        applyPerformanceFee();

        // 3. 전체 유동성 제거 (최소 수령량 없음)
        PositionSnapshot remaining = engine.positions(positionId);
        if (remaining.hasLiquidity()) {
            engine.decreaseLiquidity(binding.address(), new DecreaseLiquidityParams(
                positionId, remaining.liquidity(), TokenAmounts.ZERO, binding.deadline()
            ));
        }

        // 4. collect-after-teardown (원금, 수수료 미적용)
        TokenAmounts principal = engine.collect(binding.address(), CollectParams.all(positionId, binding.address()));
        ledger.settlePrincipal(principal);

        engine.burn(binding.address(), positionId);
        ledger.clearPrincipal();
        state.clearPosition(PositionAction.CLOSE);

        log.debug("Teardown of {} completed: earned={}, principal={}", positionId, earned, principal);
        return principal;
    }

    /**
     * collect-while-active 단계.
     *
     * <p>해체 1단계와 명시적 collect가 공유합니다. 부분 decrease로 미수령 잔고에 옮겨진 원금은
     * 수령액에서 먼저 차감되어 수입으로 적립되지 않습니다.</p>
     *
     * @param params 회수 파라미터
     * @return 회수된 총 수량
     */
    TokenAmounts collectIncome(CollectParams params) {
        LiquidityEngine engine = binding.collaborators().liquidityEngine();
        boolean liquidityObserved = engine.positions(params.positionId()).hasLiquidity();
        TokenAmounts proceeds = engine.collect(binding.address(), params);
        TokenAmounts credited = state.ledger().creditCollected(proceeds, liquidityObserved);
        log.debug("Collected {} from {} (liquidityObserved={}, credited={})",
            proceeds, params.positionId(), liquidityObserved, credited);
        return proceeds;
    }

    /**
     * 성과 수수료 적용 단계.
     *
     * @return 징수된 수수료
     */
    TokenAmounts applyPerformanceFee() {
        ProtocolFees fees = binding.collaborators().feeSource().protocolFees();
        TokenAmounts feeBase = state.ledger().drain();
        TokenAmounts fee = PerformanceFee.compute(feeBase, fees.feeBps());
        if (fee.isZero()) {
            return fee;
        }

        TokenLedger tokens = binding.collaborators().tokens();
        transferIfPositive(tokens, binding.token0(), fees, fee.amount0());
        transferIfPositive(tokens, binding.token1(), fees, fee.amount1());

        events.emit(new PerformanceFeeTaken(binding.address(), fees.recipient(), fees.feeBps(), feeBase, fee));
        log.info("Performance fee taken: base={}, fee={}, bps={}, recipient={}",
            feeBase, fee, fees.feeBps(), fees.recipient());
        return fee;
    }

    private void transferIfPositive(TokenLedger tokens, Address token,
                                    ProtocolFees fees, BigInteger amount) {
        if (amount.signum() > 0) {
            tokens.transfer(token, binding.address(), fees.recipient(), amount);
        }
    }
}
