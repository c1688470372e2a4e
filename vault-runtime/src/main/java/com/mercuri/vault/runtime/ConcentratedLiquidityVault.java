package com.mercuri.vault.runtime;

import com.mercuri.vault.application.vault.Vault;
import com.mercuri.vault.application.vault.VaultSnapshot;
import com.mercuri.vault.core.auth.AuthorizationGate;
import com.mercuri.vault.core.auth.OperationClass;
import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.event.Deposited;
import com.mercuri.vault.core.event.ManagerChanged;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PoolKey;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;
import com.mercuri.vault.core.protection.ReentrancyGuard;
import com.mercuri.vault.core.spi.CollectParams;
import com.mercuri.vault.core.spi.DecreaseLiquidityParams;
import com.mercuri.vault.core.spi.ExactInputSingleParams;
import com.mercuri.vault.core.spi.IncreaseLiquidityParams;
import com.mercuri.vault.core.spi.MintParams;
import com.mercuri.vault.core.spi.MintResult;
import com.mercuri.vault.core.statemachine.PositionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * {@link Vault} 구현체.
 *
 * <p>모든 상태 변경 진입점은 같은 순서를 따릅니다:</p>
 * <ol>
 *   <li>{@link AtomicExecution} (ReentrancyGuard + 스냅샷/저널)</li>
 *   <li>{@link AuthorizationGate} (작업 등급별 권한)</li>
 *   <li>컴포넌트 위임 (검증 → 외부 호출 → 장부/상태 갱신 → 알림)</li>
 * </ol>
 *
 * <p><strong>컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link PositionLifecycleController}: mint / increase / decrease / collect / burn / close</li>
 *   <li>{@link TeardownSequence}: 4단계 해체와 성과 수수료</li>
 *   <li>{@link WithdrawalOrchestrator}: Owner 전용 전체 출금</li>
 *   <li>{@link RebalanceGate}: Vault 토큰 간 스왑</li>
 *   <li>{@link NativeReceiptGuard}: 네이티브 자산 수신</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 인스턴스당 하나의 작업만 실행됩니다. 상태는 인스턴스 간에 공유되지 않습니다.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public final class ConcentratedLiquidityVault implements Vault {

    private static final Logger log = LoggerFactory.getLogger(ConcentratedLiquidityVault.class);

    private final VaultBinding binding;
    private final VaultState state;
    private final AuthorizationGate gate;
    private final AtomicExecution execution;
    private final EventBuffer events;
    private final PositionLifecycleController lifecycle;
    private final WithdrawalOrchestrator withdrawals;
    private final RebalanceGate rebalanceGate;
    private final NativeReceiptGuard receiptGuard;

    private ConcentratedLiquidityVault(VaultBinding binding, boolean unwrapNative, Address initialManager) {
        VaultCollaborators collaborators = binding.collaborators();
        this.binding = binding;
        this.state = new VaultState(initialManager, unwrapNative);
        this.gate = new AuthorizationGate(binding.owner(), state::manager, collaborators.registry());
        this.events = new EventBuffer(collaborators.listener());
        this.execution = new AtomicExecution(new ReentrancyGuard(), state, collaborators.journal(), events);

        TeardownSequence teardown = new TeardownSequence(binding, state, events);
        this.lifecycle = new PositionLifecycleController(binding, state, teardown, events);
        this.withdrawals = new WithdrawalOrchestrator(binding, state, lifecycle, events);
        this.rebalanceGate = new RebalanceGate(binding);
        this.receiptGuard = new NativeReceiptGuard(binding);
    }

    /**
     * Vault 생성.
     *
     * <p>토큰 쌍과 수수료 등급은 풀에서 읽어 고정합니다. 풀이 존재하지 않거나
     * 풀 디렉터리의 정식 풀과 일치하지 않으면 생성되지 않습니다.</p>
     *
     * @param config 생성 설정
     * @param collaborators 외부 협력자
     * @return 새 Vault
     * @throws VaultException CONFIGURATION_ERROR - 설정 또는 풀 바인딩이 유효하지 않은 경우
     */
    public static ConcentratedLiquidityVault create(VaultConfig config, VaultCollaborators collaborators) {
        if (config == null) {
            throw VaultException.configuration("config cannot be null");
        }
        if (collaborators == null) {
            throw VaultException.configuration("collaborators cannot be null");
        }
        if (collaborators.wrappedNative().address() == null || collaborators.wrappedNative().address().isZero()) {
            throw VaultException.configuration("wrapped native asset address cannot be the zero address");
        }

        PoolKey poolKey = collaborators.pools().poolKey(config.pool())
            .orElseThrow(() -> VaultException.configuration("no pool deployed at " + config.pool()));
        Address canonical = collaborators.pools().getPool(poolKey);
        if (!config.pool().equals(canonical)) {
            throw VaultException.configuration(
                String.format("pool %s is not the canonical pool for %s (canonical: %s)", config.pool(), poolKey, canonical));
        }

        VaultBinding binding = new VaultBinding(config.address(), config.owner(), config.pool(), poolKey, collaborators);
        ConcentratedLiquidityVault vault = new ConcentratedLiquidityVault(binding, config.unwrapNative(), config.manager());
        log.info("Vault {} created for owner {} on pool {} ({}/{} fee {})",
            config.address(), config.owner(), config.pool(), poolKey.token0(), poolKey.token1(), poolKey.fee());
        return vault;
    }

    // ========== 위임 가능 작업 ==========

    @Override
    public MintResult mint(Address caller, MintParams params) {
        requireArgument(params, "params");
        return execution.execute("mint", () -> {
            gate.require(caller, OperationClass.DELEGATED);
            return lifecycle.mint(params);
        });
    }

    @Override
    public TokenAmounts increaseLiquidity(Address caller, IncreaseLiquidityParams params) {
        requireArgument(params, "params");
        return execution.execute("increaseLiquidity", () -> {
            gate.require(caller, OperationClass.DELEGATED);
            return lifecycle.increaseLiquidity(params);
        });
    }

    @Override
    public TokenAmounts decreaseLiquidity(Address caller, DecreaseLiquidityParams params) {
        requireArgument(params, "params");
        return execution.execute("decreaseLiquidity", () -> {
            gate.require(caller, OperationClass.DELEGATED);
            return lifecycle.decreaseLiquidity(params);
        });
    }

    @Override
    public TokenAmounts collect(Address caller, CollectParams params) {
        requireArgument(params, "params");
        return execution.execute("collect", () -> {
            gate.require(caller, OperationClass.DELEGATED);
            return lifecycle.collect(params);
        });
    }

    @Override
    public void burn(Address caller, PositionId positionId) {
        requireArgument(positionId, "positionId");
        execution.run("burn", () -> {
            gate.require(caller, OperationClass.DELEGATED);
            lifecycle.burn(positionId);
        });
    }

    @Override
    public TokenAmounts closePosition(Address caller, PositionId positionId) {
        requireArgument(positionId, "positionId");
        return execution.execute("closePosition", () -> {
            gate.require(caller, OperationClass.DELEGATED);
            return lifecycle.closePosition(positionId);
        });
    }

    @Override
    public BigInteger rebalance(Address caller, ExactInputSingleParams params) {
        requireArgument(params, "params");
        return execution.execute("rebalance", () -> {
            gate.require(caller, OperationClass.DELEGATED);
            return rebalanceGate.rebalance(params);
        });
    }

    // ========== Owner 전용 작업 ==========

    @Override
    public void withdrawAll(Address caller) {
        execution.run("withdrawAll", () -> {
            gate.require(caller, OperationClass.OWNER_ONLY);
            withdrawals.withdrawAll();
        });
    }

    @Override
    public void deposit(Address caller, Address token, BigInteger amount) {
        requireArgument(token, "token");
        requireArgument(amount, "amount");
        execution.run("deposit", () -> {
            gate.require(caller, OperationClass.OWNER_ONLY);
            if (!binding.poolKey().pair().contains(token)) {
                throw VaultException.invalidReference("deposit token " + token + " is not a vault token");
            }
            if (amount.signum() <= 0) {
                return;
            }
            binding.collaborators().tokens().transferFrom(token, binding.address(), binding.owner(), binding.address(), amount);
            events.emit(new Deposited(binding.address(), token, amount));
        });
    }

    @Override
    public void setManager(Address caller, Address newManager) {
        requireArgument(newManager, "newManager");
        execution.run("setManager", () -> {
            gate.require(caller, OperationClass.OWNER_ONLY);
            state.setManager(newManager);
            events.emit(new ManagerChanged(binding.address(), newManager));
            log.info("Manager of {} changed to {}", binding.address(), newManager);
        });
    }

    @Override
    public void setUnwrapNative(Address caller, boolean unwrapNative) {
        execution.run("setUnwrapNative", () -> {
            gate.require(caller, OperationClass.OWNER_ONLY);
            state.setUnwrapNative(unwrapNative);
        });
    }

    // ========== 네이티브 자산 수신 ==========

    @Override
    public void receiveNative(Address sender, BigInteger amount) {
        receiptGuard.accept(sender, amount);
    }

    // ========== 조회 (마지막 커밋 상태) ==========

    @Override
    public Address address() {
        return binding.address();
    }

    @Override
    public Address owner() {
        return binding.owner();
    }

    @Override
    public Address manager() {
        return state.committed().manager();
    }

    @Override
    public Address pool() {
        return binding.pool();
    }

    @Override
    public PoolKey poolKey() {
        return binding.poolKey();
    }

    @Override
    public PositionId positionId() {
        return state.committed().positionId();
    }

    @Override
    public PositionState state() {
        return state.committed().positionState();
    }

    @Override
    public boolean unwrapNative() {
        return state.committed().unwrapNative();
    }

    @Override
    public VaultSnapshot snapshot() {
        VaultState.Snapshot committed = state.committed();
        return new VaultSnapshot(
            binding.address(),
            binding.owner(),
            committed.manager(),
            binding.pool(),
            binding.poolKey(),
            committed.positionId(),
            committed.ledger().accruedFees(),
            committed.ledger().owedPrincipal(),
            committed.unwrapNative()
        );
    }

    private static void requireArgument(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
