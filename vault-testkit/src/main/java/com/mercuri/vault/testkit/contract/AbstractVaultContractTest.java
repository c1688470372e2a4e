package com.mercuri.vault.testkit.contract;

import com.mercuri.vault.adapter.inmemory.factory.FactoryConfig;
import com.mercuri.vault.adapter.inmemory.factory.InMemoryVaultFactory;
import com.mercuri.vault.adapter.inmemory.world.InMemoryWorld;
import com.mercuri.vault.application.vault.Vault;
import com.mercuri.vault.core.event.VaultEvent;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PoolKey;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TickRange;
import com.mercuri.vault.core.model.TokenAmounts;
import com.mercuri.vault.core.model.TokenPair;
import com.mercuri.vault.core.spi.LiquidityEngine;
import com.mercuri.vault.core.spi.MintParams;
import com.mercuri.vault.core.spi.ProtocolFeeSource;
import com.mercuri.vault.runtime.ConcentratedLiquidityVault;
import com.mercuri.vault.runtime.VaultCollaborators;
import com.mercuri.vault.runtime.VaultConfig;
import org.junit.jupiter.api.BeforeEach;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Abstract base class for vault contract tests.
 *
 * <p>Every test starts from a fresh {@link InMemoryWorld} with a wrapped-native/USDC pool
 * (fee tier {@value #FEE_TIER}), an approved manager and one vault owned by {@link #owner}.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>world: ledger, wrapped native, pools, position manager, swap router, registry, event log</li>
 *   <li>factory: vault deployment and protocol fees (admin = {@code world.admin()})</li>
 *   <li>accounts: owner, manager, stranger, feeRecipient</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractVaultContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         depositToVault(1_000, 1_000);
 *         PositionId id = mintPosition(500, 500);
 *
 *         vault.closePosition(manager, id);
 *
 *         assertVaultBalances(1_000, 1_000);
 *     }
 * }
 * </pre>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public abstract class AbstractVaultContractTest {

    protected static final int FEE_TIER = 3_000;
    protected static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    protected Clock clock;
    protected InMemoryWorld world;
    protected InMemoryVaultFactory factory;

    protected Address owner;
    protected Address manager;
    protected Address stranger;
    protected Address feeRecipient;

    protected Address weth;
    protected Address usdc;
    protected Address pool;
    protected PoolKey poolKey;

    protected Vault vault;

    /**
     * Builds a fresh world and deploys the vault under test.
     */
    @BeforeEach
    void setUpWorld() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        world = InMemoryWorld.create(clock);
        factory = new InMemoryVaultFactory(world, FactoryConfig.defaults(world.admin()));

        owner = world.newAccount();
        manager = world.newAccount();
        stranger = world.newAccount();
        feeRecipient = world.newAccount();

        weth = world.wrappedNative().address();
        usdc = world.newAccount();
        poolKey = new PoolKey(TokenPair.sorted(weth, usdc), FEE_TIER);
        pool = world.newAccount();
        world.pools().register(poolKey, pool);

        world.registry().setApproved(world.admin(), manager, true);
        vault = factory.createVault(owner, manager, pool);
    }

    /**
     * Collaborators of the world with the liquidity engine and fee source replaced.
     */
    protected VaultCollaborators collaborators(LiquidityEngine engine, ProtocolFeeSource feeSource) {
        return new VaultCollaborators(engine, world.swapRouter(), world.registry(), feeSource,
            world.wrappedNative(), world.ledger(), world.ledger(), world.pools(), world.eventLog(), world, clock);
    }

    /**
     * Deploys an extra vault for {@link #owner} on {@link #pool} outside the factory.
     */
    protected Vault deployVault(VaultCollaborators collaborators) {
        Vault deployed = ConcentratedLiquidityVault.create(
            new VaultConfig(world.newAccount(), owner, manager, pool), collaborators);
        world.ledger().registerReceiver(deployed.address(), deployed);
        return deployed;
    }

    // ========== tokens ==========

    protected Address token0() {
        return poolKey.token0();
    }

    protected Address token1() {
        return poolKey.token1();
    }

    /**
     * Mints {@code amount} of {@code token} to {@code account}; wrapped native is minted fully backed.
     */
    protected void fund(Address token, Address account, long amount) {
        if (token.equals(weth)) {
            world.wrappedNative().mintWrapped(account, BigInteger.valueOf(amount));
        } else {
            world.ledger().mint(token, account, BigInteger.valueOf(amount));
        }
    }

    /**
     * Funds the owner and deposits both tokens into the vault through the owner-only deposit path.
     */
    protected void depositToVault(long amount0, long amount1) {
        depositToVault(token0(), amount0);
        depositToVault(token1(), amount1);
    }

    protected void depositToVault(Address token, long amount) {
        depositTo(vault, token, amount);
    }

    protected void depositTo(Vault target, Address token, long amount) {
        fund(token, owner, amount);
        world.ledger().approve(token, owner, target.address(), BigInteger.valueOf(amount));
        target.deposit(owner, token, BigInteger.valueOf(amount));
    }

    // ========== position ==========

    protected long deadline() {
        return NOW.getEpochSecond() + 600;
    }

    protected MintParams mintParams(long amount0, long amount1, TokenAmounts min) {
        return mintParams(vault, amount0, amount1, min);
    }

    protected MintParams mintParams(Vault target, long amount0, long amount1, TokenAmounts min) {
        return new MintParams(token0(), token1(), FEE_TIER, new TickRange(-600, 600),
            TokenAmounts.of(amount0, amount1), min, target.address(), deadline());
    }

    /**
     * Mints a position as the manager with minimum floors of one unit.
     */
    protected PositionId mintPosition(long amount0, long amount1) {
        return vault.mint(manager, mintParams(amount0, amount1, TokenAmounts.of(1, 1))).positionId();
    }

    protected void accrueFees(PositionId positionId, long fee0, long fee1) {
        world.positionManager().accrueFees(positionId, TokenAmounts.of(fee0, fee1));
    }

    protected void enableProtocolFee(int feeBps) {
        factory.setProtocolFees(world.admin(), feeBps, feeRecipient);
    }

    // ========== assertions ==========

    protected BigInteger balanceOf(Address token, Address account) {
        return world.ledger().balanceOf(token, account);
    }

    protected void assertBalance(Address token, Address account, long expected) {
        assertEquals(BigInteger.valueOf(expected), balanceOf(token, account),
            "balance of " + token + " held by " + account);
    }

    protected void assertVaultBalances(long expected0, long expected1) {
        assertBalance(token0(), vault.address(), expected0);
        assertBalance(token1(), vault.address(), expected1);
    }

    protected void assertLedgerClean() {
        assertEquals(TokenAmounts.ZERO, vault.snapshot().accruedFees(), "accrued fees must be zero between operations");
    }

    protected <T extends VaultEvent> List<T> events(Class<T> type) {
        return world.eventLog().eventsOf(type);
    }
}
