package com.mercuri.vault.adapter.inmemory.exchange;

import com.mercuri.vault.adapter.inmemory.asset.InMemoryAssetLedger;
import com.mercuri.vault.adapter.inmemory.world.Journaled;
import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PoolKey;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TickRange;
import com.mercuri.vault.core.model.TokenAmounts;
import com.mercuri.vault.core.model.TokenPair;
import com.mercuri.vault.core.spi.CollectParams;
import com.mercuri.vault.core.spi.DecreaseLiquidityParams;
import com.mercuri.vault.core.spi.IncreaseLiquidityParams;
import com.mercuri.vault.core.spi.LiquidityEngine;
import com.mercuri.vault.core.spi.MintParams;
import com.mercuri.vault.core.spi.MintResult;
import com.mercuri.vault.core.spi.PositionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory concentrated-liquidity position manager.
 *
 * <p>A deliberately simple pricing model: every unit of either token deposited adds one unit of
 * liquidity, and removing liquidity releases principal pro rata. Released principal and accrued
 * trading fees both land in the position's owed balance and leave only through {@link #collect}.
 * The manager cannot tell the two apart, exactly like the real engine.</p>
 *
 * <p><strong>Checks performed:</strong></p>
 * <ul>
 *   <li>deadline against the injected {@link Clock} (epoch seconds)</li>
 *   <li>pool existence for mint</li>
 *   <li>caller must own the position</li>
 *   <li>minimum amounts ({@link VaultException} SLIPPAGE_VIOLATION)</li>
 *   <li>burn only when liquidity and owed balances are zero</li>
 * </ul>
 *
 * <p>Not final: tests subclass it to inject faults.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public class InMemoryPositionManager implements LiquidityEngine, Journaled {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPositionManager.class);

    private final Address address;
    private final InMemoryAssetLedger ledger;
    private final InMemoryPoolDirectory pools;
    private final Clock clock;

    private Map<BigInteger, Position> positions = new HashMap<>();
    private long nextId = 1;

    public InMemoryPositionManager(Address address, InMemoryAssetLedger ledger, InMemoryPoolDirectory pools, Clock clock) {
        if (address == null || ledger == null || pools == null || clock == null) {
            throw new IllegalArgumentException("position manager dependencies cannot be null");
        }
        this.address = address;
        this.ledger = ledger;
        this.pools = pools;
        this.clock = clock;
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public synchronized MintResult mint(Address caller, MintParams params) {
        checkDeadline(params.deadline());
        PoolKey key = new PoolKey(new TokenPair(params.token0(), params.token1()), params.fee());
        if (pools.getPool(key).isZero()) {
            throw new IllegalArgumentException("pool not found: " + key);
        }
        TokenAmounts used = params.desired();
        checkMinimum(used, params.min());
        BigInteger liquidity = liquidityOf(used);
        if (liquidity.signum() == 0) {
            throw new IllegalArgumentException("cannot mint a position without liquidity");
        }
        pull(key, caller, used);

        BigInteger id = BigInteger.valueOf(nextId++);
        positions.put(id, new Position(params.recipient(), key, params.ticks(), liquidity, used, TokenAmounts.ZERO));
        log.debug("Minted position {} for {} with liquidity {}", id, params.recipient(), liquidity);
        return new MintResult(PositionId.of(id), liquidity, used);
    }

    @Override
    public synchronized TokenAmounts increaseLiquidity(Address caller, IncreaseLiquidityParams params) {
        checkDeadline(params.deadline());
        Position position = owned(caller, params.positionId());
        TokenAmounts used = params.desired();
        checkMinimum(used, params.min());
        pull(position.poolKey, caller, used);
        position.liquidity = position.liquidity.add(liquidityOf(used));
        position.principal = position.principal.plus(used);
        return used;
    }

    @Override
    public synchronized TokenAmounts decreaseLiquidity(Address caller, DecreaseLiquidityParams params) {
        checkDeadline(params.deadline());
        Position position = owned(caller, params.positionId());
        BigInteger removed = params.liquidity();
        if (removed.signum() == 0 || removed.compareTo(position.liquidity) > 0) {
            throw new IllegalArgumentException(
                String.format("invalid liquidity to remove (requested: %s, available: %s)", removed, position.liquidity));
        }
        TokenAmounts released = new TokenAmounts(
            position.principal.amount0().multiply(removed).divide(position.liquidity),
            position.principal.amount1().multiply(removed).divide(position.liquidity)
        );
        checkMinimum(released, params.min());
        position.liquidity = position.liquidity.subtract(removed);
        position.principal = position.principal.saturatingMinus(released);
        position.owed = position.owed.plus(released);
        return released;
    }

    @Override
    public synchronized TokenAmounts collect(Address caller, CollectParams params) {
        Position position = owned(caller, params.positionId());
        TokenAmounts paid = position.owed.min(params.max());
        position.owed = position.owed.saturatingMinus(paid);
        if (paid.amount0().signum() > 0) {
            ledger.transfer(position.poolKey.token0(), address, params.recipient(), paid.amount0());
        }
        if (paid.amount1().signum() > 0) {
            ledger.transfer(position.poolKey.token1(), address, params.recipient(), paid.amount1());
        }
        return paid;
    }

    @Override
    public synchronized void burn(Address caller, PositionId positionId) {
        Position position = owned(caller, positionId);
        if (position.liquidity.signum() != 0 || !position.owed.isZero()) {
            throw new IllegalStateException("position not cleared: " + positionId);
        }
        positions.remove(positionId.getValue());
    }

    @Override
    public synchronized PositionSnapshot positions(PositionId positionId) {
        Position position = find(positionId);
        return new PositionSnapshot(position.poolKey, position.ticks, position.liquidity, position.owed);
    }

    /**
     * Simulates trading fees earned by an in-range position.
     *
     * <p>Funds the manager with the fee tokens and credits them to the position's owed balance.</p>
     *
     * @throws IllegalStateException if the position has no liquidity
     */
    public synchronized void accrueFees(PositionId positionId, TokenAmounts fees) {
        Position position = find(positionId);
        if (position.liquidity.signum() == 0) {
            throw new IllegalStateException("position without liquidity earns no fees: " + positionId);
        }
        ledger.mint(position.poolKey.token0(), address, fees.amount0());
        ledger.mint(position.poolKey.token1(), address, fees.amount1());
        position.owed = position.owed.plus(fees);
    }

    /**
     * Returns the principal still backing the position's liquidity.
     */
    public synchronized TokenAmounts principalOf(PositionId positionId) {
        return find(positionId).principal;
    }

    public synchronized boolean exists(PositionId positionId) {
        return positionId != null && positions.containsKey(positionId.getValue());
    }

    public synchronized Address ownerOf(PositionId positionId) {
        return find(positionId).owner;
    }

    // ========== Journaled ==========

    @Override
    public synchronized Object captureState() {
        Map<BigInteger, Position> copy = new HashMap<>();
        positions.forEach((id, position) -> copy.put(id, position.copy()));
        return new State(copy, nextId);
    }

    @Override
    public synchronized void restoreState(Object state) {
        State captured = (State) state;
        Map<BigInteger, Position> copy = new HashMap<>();
        captured.positions().forEach((id, position) -> copy.put(id, position.copy()));
        this.positions = copy;
        this.nextId = captured.nextId();
    }

    // ========== internals ==========

    private void pull(PoolKey key, Address from, TokenAmounts amounts) {
        if (amounts.amount0().signum() > 0) {
            ledger.transferFrom(key.token0(), address, from, address, amounts.amount0());
        }
        if (amounts.amount1().signum() > 0) {
            ledger.transferFrom(key.token1(), address, from, address, amounts.amount1());
        }
    }

    private Position owned(Address caller, PositionId positionId) {
        Position position = find(positionId);
        if (!position.owner.equals(caller)) {
            throw new IllegalStateException("Not approved: " + caller + " does not own " + positionId);
        }
        return position;
    }

    private Position find(PositionId positionId) {
        Position position = positionId == null ? null : positions.get(positionId.getValue());
        if (position == null) {
            throw new IllegalArgumentException("Invalid token ID: " + positionId);
        }
        return position;
    }

    private void checkDeadline(long deadline) {
        long now = clock.instant().getEpochSecond();
        if (now > deadline) {
            throw new IllegalStateException("Transaction too old (deadline: " + deadline + ", now: " + now + ")");
        }
    }

    private static void checkMinimum(TokenAmounts actual, TokenAmounts min) {
        if (actual.amount0().compareTo(min.amount0()) < 0 || actual.amount1().compareTo(min.amount1()) < 0) {
            throw VaultException.slippage("Price slippage check (actual: " + actual + ", min: " + min + ")");
        }
    }

    private static BigInteger liquidityOf(TokenAmounts amounts) {
        return amounts.amount0().add(amounts.amount1());
    }

    private static final class Position {
        private final Address owner;
        private final PoolKey poolKey;
        private final TickRange ticks;
        private BigInteger liquidity;
        private TokenAmounts principal;
        private TokenAmounts owed;

        private Position(Address owner, PoolKey poolKey, TickRange ticks,
                         BigInteger liquidity, TokenAmounts principal, TokenAmounts owed) {
            this.owner = owner;
            this.poolKey = poolKey;
            this.ticks = ticks;
            this.liquidity = liquidity;
            this.principal = principal;
            this.owed = owed;
        }

        private Position copy() {
            return new Position(owner, poolKey, ticks, liquidity, principal, owed);
        }
    }

    private record State(Map<BigInteger, Position> positions, long nextId) {
    }
}
