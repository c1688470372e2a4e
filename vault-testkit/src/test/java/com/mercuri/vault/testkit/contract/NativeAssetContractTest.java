package com.mercuri.vault.testkit.contract;

import com.mercuri.vault.application.vault.Vault;
import com.mercuri.vault.core.error.VaultErrorCode;
import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.event.NativeWithdrawn;
import com.mercuri.vault.core.event.Withdrawn;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PoolKey;
import com.mercuri.vault.core.model.TokenPair;
import com.mercuri.vault.core.spi.ExactInputSingleParams;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for native-asset handling: unwrap on withdrawal and the receipt guard.
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
class NativeAssetContractTest extends AbstractVaultContractTest {

    @Test
    void testWithdrawAll_WithUnwrap_SendsNativeToOwner() {
        // Given
        depositToVault(weth, 1_000);
        depositToVault(usdc, 2_000);
        vault.setUnwrapNative(owner, true);

        // When
        vault.withdrawAll(owner);

        // Then: wrapped side arrives as native, the other token as a token transfer
        assertEquals(BigInteger.valueOf(1_000), world.ledger().balanceOf(owner));
        assertBalance(weth, owner, 0);
        assertBalance(usdc, owner, 2_000);
        assertBalance(weth, vault.address(), 0);
        assertBalance(usdc, vault.address(), 0);
        assertEquals(BigInteger.ZERO, world.ledger().balanceOf(vault.address()));

        List<NativeWithdrawn> nativeEvents = events(NativeWithdrawn.class);
        assertEquals(1, nativeEvents.size());
        assertEquals(owner, nativeEvents.get(0).to());
        assertEquals(BigInteger.valueOf(1_000), nativeEvents.get(0).amount());
        List<Withdrawn> tokenEvents = events(Withdrawn.class);
        assertEquals(1, tokenEvents.size());
        assertEquals(usdc, tokenEvents.get(0).token());
    }

    @Test
    void testWithdrawAll_WithoutUnwrap_SendsWrappedToken() {
        depositToVault(weth, 1_000);
        depositToVault(usdc, 2_000);

        vault.withdrawAll(owner);

        assertBalance(weth, owner, 1_000);
        assertEquals(BigInteger.ZERO, world.ledger().balanceOf(owner));
        assertTrue(events(NativeWithdrawn.class).isEmpty());
        assertEquals(2, events(Withdrawn.class).size());
    }

    @Test
    void testWithdrawAll_ZeroBalances_NoTransferNoEvent() {
        int before = world.eventLog().events().size();

        vault.withdrawAll(owner);

        assertEquals(before, world.eventLog().events().size());
        assertBalance(weth, owner, 0);
        assertBalance(usdc, owner, 0);
    }

    @Test
    void testWithdrawAll_OneZeroBalance_SweepsOnlyTheOther() {
        depositToVault(usdc, 300);

        vault.withdrawAll(owner);

        List<Withdrawn> withdrawn = events(Withdrawn.class);
        assertEquals(1, withdrawn.size());
        assertEquals(usdc, withdrawn.get(0).token());
        assertEquals(BigInteger.valueOf(300), withdrawn.get(0).amount());
    }

    @Test
    void testWithdrawAll_OwnerRejectsNative_TransferFailureAndRevert() {
        // Given
        depositToVault(weth, 1_000);
        depositToVault(usdc, 2_000);
        vault.setUnwrapNative(owner, true);
        world.ledger().registerReceiver(owner, (sender, amount) -> {
            throw new IllegalStateException("owner cannot receive native");
        });
        int before = world.eventLog().events().size();

        // When
        VaultException exception = assertThrows(VaultException.class, () -> vault.withdrawAll(owner));

        // Then
        assertEquals(VaultErrorCode.TRANSFER_FAILURE, exception.getErrorCode());
        assertBalance(weth, vault.address(), 1_000);
        assertBalance(usdc, vault.address(), 2_000);
        assertBalance(usdc, owner, 0);
        assertEquals(BigInteger.ZERO, world.ledger().balanceOf(owner));
        assertEquals(before, world.eventLog().events().size());
    }

    @Test
    void testReceiveNative_FromStranger_Unauthorized() {
        VaultException exception = assertThrows(VaultException.class,
            () -> vault.receiveNative(stranger, BigInteger.ONE));
        assertEquals(VaultErrorCode.UNAUTHORIZED, exception.getErrorCode());

        // Through the ledger the rejected receipt is simply not delivered
        world.ledger().mintNative(stranger, BigInteger.TEN);
        assertFalse(world.ledger().send(stranger, vault.address(), BigInteger.ONE));
        assertEquals(BigInteger.TEN, world.ledger().balanceOf(stranger));
        assertEquals(BigInteger.ZERO, world.ledger().balanceOf(vault.address()));
    }

    @Test
    void testReceiveNative_FromWrappedContract_Accepted() {
        assertDoesNotThrow(() -> vault.receiveNative(weth, BigInteger.ONE));
    }

    @Test
    void testSwapRefund_IsRewrapped() {
        // Given
        depositToVault(1_000, 1_000);
        Address router = world.swapRouter().address();
        fund(weth, router, 1_000);
        world.ledger().mintNative(router, BigInteger.valueOf(5));
        world.swapRouter().setNativeRefund(BigInteger.valueOf(5));

        // When
        vault.rebalance(manager, new ExactInputSingleParams(
            usdc, weth, FEE_TIER, vault.address(), BigInteger.valueOf(100), BigInteger.valueOf(100), null));

        // Then
        assertBalance(weth, vault.address(), 1_105);
        assertBalance(usdc, vault.address(), 900);
        assertEquals(BigInteger.ZERO, world.ledger().balanceOf(vault.address()));
    }

    @Test
    void testSwapRefund_PairWithoutWrappedNative_InvalidReference() {
        // Given: a second vault on a pool that does not hold the wrapped native asset
        Address dai = world.newAccount();
        Address stablePool = world.newAccount();
        world.pools().register(new PoolKey(TokenPair.sorted(usdc, dai), 500), stablePool);
        Vault stableVault = factory.createVault(owner, manager, stablePool);
        Address router = world.swapRouter().address();

        // When & Then
        VaultException exception = assertThrows(VaultException.class,
            () -> stableVault.receiveNative(router, BigInteger.ONE));
        assertEquals(VaultErrorCode.INVALID_REFERENCE, exception.getErrorCode());

        world.ledger().mintNative(router, BigInteger.ONE);
        assertFalse(world.ledger().send(router, stableVault.address(), BigInteger.ONE));
    }
}
