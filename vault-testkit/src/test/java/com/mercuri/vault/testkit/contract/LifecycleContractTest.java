package com.mercuri.vault.testkit.contract;

import com.mercuri.vault.application.vault.VaultSnapshot;
import com.mercuri.vault.core.error.VaultErrorCode;
import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.event.Deposited;
import com.mercuri.vault.core.event.PerformanceFeeTaken;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TickRange;
import com.mercuri.vault.core.model.TokenAmounts;
import com.mercuri.vault.core.spi.CollectParams;
import com.mercuri.vault.core.spi.DecreaseLiquidityParams;
import com.mercuri.vault.core.spi.IncreaseLiquidityParams;
import com.mercuri.vault.core.spi.MintParams;
import com.mercuri.vault.core.statemachine.PositionState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the position lifecycle (EMPTY ⇄ ACTIVE).
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>positionId is non-zero exactly while the vault is ACTIVE</li>
 *   <li>Operations in the wrong state → INVALID_STATE</li>
 *   <li>Foreign position id, pool or recipient → INVALID_REFERENCE</li>
 *   <li>Manual decrease, collect and burn return the vault to EMPTY</li>
 *   <li>Owner deposits</li>
 * </ul>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
class LifecycleContractTest extends AbstractVaultContractTest {

    @Test
    void testMint_ActivatesVault() {
        depositToVault(1_000, 1_000);

        PositionId id = mintPosition(500, 400);

        assertEquals(PositionState.ACTIVE, vault.state());
        assertFalse(id.isNone());
        assertEquals(id, vault.positionId());
        assertEquals(vault.address(), world.positionManager().ownerOf(id));
        assertVaultBalances(500, 600);
        assertEquals(BigInteger.ZERO,
            world.ledger().allowance(token0(), vault.address(), world.positionManager().address()));
    }

    @Test
    void testMint_WhileActive_InvalidState() {
        depositToVault(1_000, 1_000);
        mintPosition(500, 500);

        assertErrorCode(VaultErrorCode.INVALID_STATE, () -> mintPosition(100, 100));
    }

    @Test
    void testOperations_WhileEmpty_InvalidState() {
        PositionId any = PositionId.of(1);

        assertErrorCode(VaultErrorCode.INVALID_STATE, () -> vault.increaseLiquidity(manager,
            new IncreaseLiquidityParams(any, TokenAmounts.of(1, 1), TokenAmounts.ZERO, deadline())));
        assertErrorCode(VaultErrorCode.INVALID_STATE, () -> vault.decreaseLiquidity(manager,
            new DecreaseLiquidityParams(any, BigInteger.ONE, TokenAmounts.ZERO, deadline())));
        assertErrorCode(VaultErrorCode.INVALID_STATE, () -> vault.collect(manager, CollectParams.all(any, vault.address())));
        assertErrorCode(VaultErrorCode.INVALID_STATE, () -> vault.burn(manager, any));
        assertErrorCode(VaultErrorCode.INVALID_STATE, () -> vault.closePosition(manager, any));
    }

    @Test
    void testOperations_OnForeignPositionId_InvalidReference() {
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);
        PositionId other = PositionId.of(id.getValue().add(BigInteger.TEN));

        assertErrorCode(VaultErrorCode.INVALID_REFERENCE, () -> vault.closePosition(manager, other));
        assertErrorCode(VaultErrorCode.INVALID_REFERENCE, () -> vault.burn(manager, other));
        assertErrorCode(VaultErrorCode.INVALID_REFERENCE, () -> vault.decreaseLiquidity(manager,
            new DecreaseLiquidityParams(other, BigInteger.ONE, TokenAmounts.ZERO, deadline())));
        assertEquals(id, vault.positionId());
    }

    @Test
    void testMint_WrongFeeTier_InvalidReference() {
        depositToVault(1_000, 1_000);
        MintParams wrongTier = new MintParams(token0(), token1(), 500, new TickRange(-60, 60),
            TokenAmounts.of(10, 10), TokenAmounts.of(1, 1), vault.address(), deadline());

        assertErrorCode(VaultErrorCode.INVALID_REFERENCE, () -> vault.mint(manager, wrongTier));
    }

    @Test
    void testMint_ForeignRecipient_InvalidReference() {
        depositToVault(1_000, 1_000);
        MintParams toManager = new MintParams(token0(), token1(), FEE_TIER, new TickRange(-60, 60),
            TokenAmounts.of(10, 10), TokenAmounts.of(1, 1), manager, deadline());

        assertErrorCode(VaultErrorCode.INVALID_REFERENCE, () -> vault.mint(manager, toManager));
        assertEquals(PositionState.EMPTY, vault.state());
    }

    @Test
    void testCollect_ForeignRecipient_InvalidReference() {
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);
        accrueFees(id, 10, 10);

        assertErrorCode(VaultErrorCode.INVALID_REFERENCE, () -> vault.collect(manager, CollectParams.all(id, manager)));
        assertBalance(token0(), manager, 0);
    }

    @Test
    void testManualTeardown_DecreaseCollectBurn_ReturnsToEmpty() {
        // Given
        enableProtocolFee(1_000);
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);

        // When
        vault.decreaseLiquidity(manager,
            new DecreaseLiquidityParams(id, BigInteger.valueOf(1_000), TokenAmounts.ZERO, deadline()));
        vault.collect(manager, CollectParams.all(id, vault.address()));
        vault.burn(manager, id);

        // Then: principal came back untaxed
        assertEquals(PositionState.EMPTY, vault.state());
        assertTrue(vault.positionId().isNone());
        assertVaultBalances(1_000, 1_000);
        assertTrue(events(PerformanceFeeTaken.class).isEmpty());
        assertEquals(TokenAmounts.ZERO, vault.snapshot().owedPrincipal());
    }

    @Test
    void testBurn_WithLiquidity_EngineRefuses_StateUnchanged() {
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);

        assertThrows(IllegalStateException.class, () -> vault.burn(manager, id));

        assertEquals(PositionState.ACTIVE, vault.state());
        assertEquals(id, vault.positionId());
    }

    @Test
    void testDecrease_EngineMinimum_Slippage() {
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);

        assertErrorCode(VaultErrorCode.SLIPPAGE_VIOLATION, () -> vault.decreaseLiquidity(manager,
            new DecreaseLiquidityParams(id, BigInteger.valueOf(100), TokenAmounts.of(51, 0), deadline())));
        assertEquals(TokenAmounts.ZERO, vault.snapshot().owedPrincipal());
    }

    @Test
    void testDeposit_EmitsEvent() {
        depositToVault(token0(), 250);

        List<Deposited> deposits = events(Deposited.class);
        assertEquals(1, deposits.size());
        assertEquals(token0(), deposits.get(0).token());
        assertEquals(BigInteger.valueOf(250), deposits.get(0).amount());
        assertVaultBalances(250, 0);
    }

    @Test
    void testDeposit_Zero_NoEvent() {
        vault.deposit(owner, token1(), BigInteger.ZERO);

        assertTrue(events(Deposited.class).isEmpty());
    }

    @Test
    void testDeposit_ForeignToken_InvalidReference() {
        assertErrorCode(VaultErrorCode.INVALID_REFERENCE,
            () -> vault.deposit(owner, world.newAccount(), BigInteger.ONE));
    }

    @Test
    void testSnapshot_ReflectsState() {
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);

        VaultSnapshot snapshot = vault.snapshot();

        assertEquals(vault.address(), snapshot.address());
        assertEquals(owner, snapshot.owner());
        assertEquals(manager, snapshot.manager());
        assertEquals(pool, snapshot.pool());
        assertEquals(poolKey, snapshot.poolKey());
        assertEquals(id, snapshot.positionId());
        assertEquals(PositionState.ACTIVE, snapshot.state());
        assertFalse(snapshot.unwrapNative());
    }

    private static void assertErrorCode(VaultErrorCode expected, Executable executable) {
        VaultException exception = assertThrows(VaultException.class, executable);
        assertEquals(expected, exception.getErrorCode());
    }
}
