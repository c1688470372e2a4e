package com.mercuri.vault.testkit.contract;

import com.mercuri.vault.core.event.PerformanceFeeTaken;
import com.mercuri.vault.core.event.PositionClosed;
import com.mercuri.vault.core.event.VaultEvent;
import com.mercuri.vault.core.event.Withdrawn;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;
import com.mercuri.vault.core.spi.CollectParams;
import com.mercuri.vault.core.spi.DecreaseLiquidityParams;
import com.mercuri.vault.core.statemachine.PositionState;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for fee/principal separation during teardown.
 *
 * <p>The performance fee is charged on swap income collected while the position still has
 * liquidity, never on principal released by a decrease.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Scenario B: close with accrued income → fee on income only, principal untouched</li>
 *   <li>Fee rounding is floor per token</li>
 *   <li>Partial decrease → released principal is never taxed by a later collect</li>
 *   <li>Protocol fee is read live at teardown time</li>
 *   <li>withdrawAll on an active position tears down, then sweeps</li>
 * </ul>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
class TeardownContractTest extends AbstractVaultContractTest {

    @Test
    void testClose_WithAccruedIncome_FeeAppliedToIncomeOnly() {
        // Given
        enableProtocolFee(1_000);
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);
        accrueFees(id, 100, 50);

        // When
        TokenAmounts principal = vault.closePosition(owner, id);

        // Then: 10% of income to the recipient, principal returned in full
        assertEquals(TokenAmounts.of(500, 500), principal);
        assertBalance(token0(), feeRecipient, 10);
        assertBalance(token1(), feeRecipient, 5);
        assertVaultBalances(1_090, 1_045);

        List<PerformanceFeeTaken> fees = events(PerformanceFeeTaken.class);
        assertEquals(1, fees.size());
        assertEquals(TokenAmounts.of(100, 50), fees.get(0).feeBase());
        assertEquals(TokenAmounts.of(10, 5), fees.get(0).fee());
        assertEquals(1_000, fees.get(0).feeBps());
        assertEquals(feeRecipient, fees.get(0).recipient());
    }

    @Test
    void testClose_ReturnsToEmpty_AndBurnsEnginePosition() {
        // Given
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);

        // When
        vault.closePosition(manager, id);

        // Then
        assertEquals(PositionState.EMPTY, vault.state());
        assertTrue(vault.positionId().isNone());
        assertFalse(world.positionManager().exists(id));
        assertLedgerClean();
        assertEquals(TokenAmounts.ZERO, vault.snapshot().owedPrincipal());

        List<PositionClosed> closed = events(PositionClosed.class);
        assertEquals(1, closed.size());
        assertEquals(id, closed.get(0).positionId());
        assertEquals(TokenAmounts.of(500, 500), closed.get(0).principal());
    }

    @Test
    void testClose_WithoutIncome_NoFeeEvent() {
        // Given
        enableProtocolFee(1_000);
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);

        // When
        vault.closePosition(manager, id);

        // Then
        assertTrue(events(PerformanceFeeTaken.class).isEmpty());
        assertVaultBalances(1_000, 1_000);
        assertBalance(token0(), feeRecipient, 0);
    }

    @Test
    void testClose_WithZeroFeeBps_IncomeStaysInVault() {
        // Given: no protocol fee configured
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);
        accrueFees(id, 100, 50);

        // When
        vault.closePosition(manager, id);

        // Then
        assertTrue(events(PerformanceFeeTaken.class).isEmpty());
        assertVaultBalances(1_100, 1_050);
    }

    @Test
    void testClose_FeeRoundsDownPerToken() {
        // Given
        enableProtocolFee(1_000);
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);
        accrueFees(id, 99, 9);

        // When
        vault.closePosition(manager, id);

        // Then: floor(99 * 0.1) = 9, floor(9 * 0.1) = 0
        PerformanceFeeTaken taken = events(PerformanceFeeTaken.class).get(0);
        assertEquals(TokenAmounts.of(9, 0), taken.fee());
        assertBalance(token0(), feeRecipient, 9);
        assertBalance(token1(), feeRecipient, 0);
        assertVaultBalances(1_090, 1_009);
    }

    @Test
    void testClose_UsesFeeInForceAtTeardown() {
        // Given: the fee changes after the position was opened
        enableProtocolFee(1_000);
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);
        accrueFees(id, 100, 50);
        factory.setProtocolFees(world.admin(), 2_000, feeRecipient);

        // When
        vault.closePosition(manager, id);

        // Then
        assertBalance(token0(), feeRecipient, 20);
        assertBalance(token1(), feeRecipient, 10);
    }

    @Test
    void testPartialDecrease_ThenCollect_PrincipalNeverTaxed() {
        // Given
        enableProtocolFee(1_000);
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);

        // When: half of the liquidity is removed and its principal collected
        TokenAmounts released = vault.decreaseLiquidity(manager,
            new DecreaseLiquidityParams(id, BigInteger.valueOf(500), TokenAmounts.ZERO, deadline()));
        TokenAmounts collected = vault.collect(manager, CollectParams.all(id, vault.address()));

        // Then
        assertEquals(TokenAmounts.of(250, 250), released);
        assertEquals(TokenAmounts.of(250, 250), collected);
        assertTrue(events(PerformanceFeeTaken.class).isEmpty());
        assertBalance(token0(), feeRecipient, 0);
        assertVaultBalances(750, 750);
        assertEquals(TokenAmounts.ZERO, vault.snapshot().owedPrincipal());
        assertLedgerClean();
    }

    @Test
    void testPartialDecrease_ThenClose_OnlyIncomeTaxed() {
        // Given: principal released but left uncollected, then income accrues
        enableProtocolFee(1_000);
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);
        vault.decreaseLiquidity(manager,
            new DecreaseLiquidityParams(id, BigInteger.valueOf(500), TokenAmounts.ZERO, deadline()));
        assertEquals(TokenAmounts.of(250, 250), vault.snapshot().owedPrincipal());
        accrueFees(id, 20, 10);

        // When
        vault.closePosition(owner, id);

        // Then: the step-one collect carries 250/250 principal, taxed only on 20/10 income
        PerformanceFeeTaken taken = events(PerformanceFeeTaken.class).get(0);
        assertEquals(TokenAmounts.of(20, 10), taken.feeBase());
        assertEquals(TokenAmounts.of(2, 1), taken.fee());
        assertVaultBalances(1_018, 1_009);
        assertEquals(TokenAmounts.ZERO, vault.snapshot().owedPrincipal());
    }

    @Test
    void testExplicitCollect_WhileActive_TaxesIncomeImmediately() {
        // Given
        enableProtocolFee(500);
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);
        accrueFees(id, 200, 100);

        // When
        TokenAmounts collected = vault.collect(manager, CollectParams.all(id, vault.address()));

        // Then
        assertEquals(TokenAmounts.of(200, 100), collected);
        assertBalance(token0(), feeRecipient, 10);
        assertBalance(token1(), feeRecipient, 5);
        assertVaultBalances(690, 595);
        assertEquals(PositionState.ACTIVE, vault.state());
        assertLedgerClean();
    }

    @Test
    void testWithdrawAll_WithActivePosition_TearsDownThenSweeps() {
        // Given
        enableProtocolFee(1_000);
        depositToVault(1_000, 1_000);
        PositionId id = mintPosition(500, 500);
        accrueFees(id, 100, 50);

        // When
        vault.withdrawAll(owner);

        // Then
        assertEquals(PositionState.EMPTY, vault.state());
        assertVaultBalances(0, 0);
        assertBalance(token0(), owner, 1_090);
        assertBalance(token1(), owner, 1_045);

        List<VaultEvent> tail = world.eventLog().events();
        tail = tail.subList(tail.size() - 4, tail.size());
        assertInstanceOf(PerformanceFeeTaken.class, tail.get(0));
        assertInstanceOf(PositionClosed.class, tail.get(1));
        assertInstanceOf(Withdrawn.class, tail.get(2));
        assertInstanceOf(Withdrawn.class, tail.get(3));
        assertEquals(token0(), ((Withdrawn) tail.get(2)).token());
        assertEquals(token1(), ((Withdrawn) tail.get(3)).token());
    }

    @Test
    void testMint_AfterClose_OpensNewPosition() {
        // Given
        depositToVault(1_000, 1_000);
        PositionId first = mintPosition(500, 500);
        vault.closePosition(manager, first);

        // When
        PositionId second = mintPosition(400, 400);

        // Then
        assertNotEquals(first, second);
        assertEquals(second, vault.positionId());
        assertEquals(PositionState.ACTIVE, vault.state());
    }
}
