package com.mercuri.vault.runtime;

import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.event.PositionClosed;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PoolKey;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;
import com.mercuri.vault.core.spi.CollectParams;
import com.mercuri.vault.core.spi.DecreaseLiquidityParams;
import com.mercuri.vault.core.spi.IncreaseLiquidityParams;
import com.mercuri.vault.core.spi.LiquidityEngine;
import com.mercuri.vault.core.spi.MintParams;
import com.mercuri.vault.core.spi.MintResult;
import com.mercuri.vault.core.statemachine.PositionAction;
import com.mercuri.vault.core.statemachine.PositionTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 포지션 생명주기 컨트롤러.
 *
 * <p>Vault의 단일 외부 포지션에 대한 mint / increase / decrease / collect / burn / close를 수행합니다.
 * 권한 확인은 호출 전에 끝나 있어야 하며, 이 클래스의 모든 검증은 외부 엔진 호출 이전에 수행됩니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>상태: {@link PositionTransition} 규칙 (위반 시 INVALID_STATE)</li>
 *   <li>positionId: 요청 ID == Vault의 현재 ID (위반 시 INVALID_REFERENCE)</li>
 *   <li>mint: 토큰 쌍 / 수수료 등급 == 바인딩된 풀, 수신자 == Vault (위반 시 INVALID_REFERENCE)</li>
 *   <li>mint: 두 최소 수령량 모두 0 초과 (위반 시 SLIPPAGE_VIOLATION)</li>
 * </ul>
 */
final class PositionLifecycleController {

    private static final Logger log = LoggerFactory.getLogger(PositionLifecycleController.class);

    private final VaultBinding binding;
    private final VaultState state;
    private final TeardownSequence teardown;
    private final EventBuffer events;
    private final ExactAllowance allowance;

    PositionLifecycleController(VaultBinding binding, VaultState state, TeardownSequence teardown, EventBuffer events) {
        this.binding = binding;
        this.state = state;
        this.teardown = teardown;
        this.events = events;
        this.allowance = new ExactAllowance(binding.collaborators().tokens(), binding.address());
    }

    MintResult mint(MintParams params) {
        PositionTransition.validate(state.positionState(), PositionAction.MINT);
        validatePool(params);
        if (!params.recipient().equals(binding.address())) {
            throw VaultException.invalidReference("mint recipient must be the vault itself (current: " + params.recipient() + ")");
        }
        if (params.min().amount0().signum() <= 0 || params.min().amount1().signum() <= 0) {
            throw VaultException.slippage("mint requires non-zero minimum amounts (current: " + params.min() + ")");
        }

        LiquidityEngine engine = binding.collaborators().liquidityEngine();
        grantDesired(params.desired());
        MintResult result = engine.mint(binding.address(), params);
        revokeDesired();

        state.activate(result.positionId());
        log.info("Minted {} with liquidity {} (amounts: {})", result.positionId(), result.liquidity(), result.amounts());
        return result;
    }

    TokenAmounts increaseLiquidity(IncreaseLiquidityParams params) {
        requireOwnPosition(params.positionId(), PositionAction.INCREASE);

        grantDesired(params.desired());
        TokenAmounts added = binding.collaborators().liquidityEngine().increaseLiquidity(binding.address(), params);
        revokeDesired();

        log.debug("Increased {} by {}", params.positionId(), added);
        return added;
    }

    TokenAmounts decreaseLiquidity(DecreaseLiquidityParams params) {
        requireOwnPosition(params.positionId(), PositionAction.DECREASE);

        TokenAmounts released = binding.collaborators().liquidityEngine().decreaseLiquidity(binding.address(), params);
        state.ledger().recordPrincipal(released);

        log.debug("Decreased {} by liquidity {}, principal owed: {}", params.positionId(), params.liquidity(), released);
        return released;
    }

    TokenAmounts collect(CollectParams params) {
        requireOwnPosition(params.positionId(), PositionAction.COLLECT);
        if (!params.recipient().equals(binding.address())) {
            throw VaultException.invalidReference("collect recipient must be the vault itself (current: " + params.recipient() + ")");
        }

        TokenAmounts proceeds = teardown.collectIncome(params);
        teardown.applyPerformanceFee();
        return proceeds;
    }

    void burn(PositionId positionId) {
        requireOwnPosition(positionId, PositionAction.BURN);

        binding.collaborators().liquidityEngine().burn(binding.address(), positionId);
        state.ledger().clearPrincipal();
        state.clearPosition(PositionAction.BURN);

        log.info("Burned {}", positionId);
    }

    TokenAmounts closePosition(PositionId positionId) {
        requireOwnPosition(positionId, PositionAction.CLOSE);
        return closeActive();
    }

    /**
     * 현재 활성 포지션 전체 해체 (withdrawAll 공용).
     *
     * @return 회수된 원금
     */
    TokenAmounts closeActive() {
        PositionId positionId = state.positionId();
        TokenAmounts principal = teardown.run(positionId);
        events.emit(new PositionClosed(binding.address(), positionId, principal));
        log.info("Closed {} (principal: {})", positionId, principal);
        return principal;
    }

    private void requireOwnPosition(PositionId requested, PositionAction action) {
        PositionTransition.validate(state.positionState(), action);
        if (!state.positionId().equals(requested)) {
            throw VaultException.invalidReference(
                String.format("%s must reference the vault position %s (requested: %s)", action, state.positionId(), requested)
            );
        }
    }

    private void validatePool(MintParams params) {
        PoolKey bound = binding.poolKey();
        if (!params.token0().equals(bound.token0()) || !params.token1().equals(bound.token1()) || params.fee() != bound.fee()) {
            throw VaultException.invalidReference(String.format(
                "mint must target the vault pool %s/%s fee %d (requested: %s/%s fee %d)",
                bound.token0(), bound.token1(), bound.fee(), params.token0(), params.token1(), params.fee()));
        }
    }

    private void grantDesired(TokenAmounts desired) {
        Address spender = binding.collaborators().liquidityEngine().address();
        allowance.grant(binding.token0(), spender, desired.amount0());
        allowance.grant(binding.token1(), spender, desired.amount1());
    }

    private void revokeDesired() {
        Address spender = binding.collaborators().liquidityEngine().address();
        allowance.revoke(binding.token0(), spender);
        allowance.revoke(binding.token1(), spender);
    }
}
