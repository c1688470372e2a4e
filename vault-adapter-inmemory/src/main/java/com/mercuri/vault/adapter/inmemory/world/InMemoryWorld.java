package com.mercuri.vault.adapter.inmemory.world;

import com.mercuri.vault.adapter.inmemory.asset.InMemoryAssetLedger;
import com.mercuri.vault.adapter.inmemory.asset.InMemoryWrappedNative;
import com.mercuri.vault.adapter.inmemory.event.InMemoryEventLog;
import com.mercuri.vault.adapter.inmemory.exchange.InMemoryPoolDirectory;
import com.mercuri.vault.adapter.inmemory.exchange.InMemoryPositionManager;
import com.mercuri.vault.adapter.inmemory.exchange.InMemorySwapRouter;
import com.mercuri.vault.adapter.inmemory.registry.InMemoryManagerRegistry;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.spi.StateJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A self-contained simulated chain: shared ledger, wrapped native asset, pools, position manager,
 * swap router, manager registry and event log.
 *
 * <p>Implements {@link StateJournal} by capturing every {@link Journaled} component at each checkpoint.
 * Reverting restores the captured state and drops that checkpoint together with every later one.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>{@code
 * InMemoryWorld world = InMemoryWorld.create(Clock.systemUTC());
 * Address usdc = world.newAccount();
 * world.pools().register(new PoolKey(TokenPair.sorted(world.wrappedNative().address(), usdc), 3000),
 *     world.newAccount());
 * }</pre>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public class InMemoryWorld implements StateJournal {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorld.class);

    private final AtomicLong addressSequence = new AtomicLong(0x1000);
    private final AtomicLong checkpointSequence = new AtomicLong();
    private final NavigableMap<Long, List<Object>> checkpoints = new TreeMap<>();

    private final Clock clock;
    private final Address admin;
    private final InMemoryAssetLedger ledger;
    private final InMemoryWrappedNative wrappedNative;
    private final InMemoryPoolDirectory pools;
    private final InMemoryPositionManager positionManager;
    private final InMemorySwapRouter swapRouter;
    private final InMemoryManagerRegistry registry;
    private final InMemoryEventLog eventLog;
    private final List<Journaled> journaled = new ArrayList<>();

    private InMemoryWorld(Clock clock) {
        this.clock = clock;
        this.admin = newAccount();
        this.ledger = new InMemoryAssetLedger();
        this.wrappedNative = new InMemoryWrappedNative(newAccount(), ledger);
        this.pools = new InMemoryPoolDirectory();
        this.positionManager = new InMemoryPositionManager(newAccount(), ledger, pools, clock);
        this.swapRouter = new InMemorySwapRouter(newAccount(), ledger, pools);
        this.registry = new InMemoryManagerRegistry(admin);
        this.eventLog = new InMemoryEventLog();
        journaled.add(ledger);
        journaled.add(positionManager);
    }

    public static InMemoryWorld create(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return new InMemoryWorld(clock);
    }

    /**
     * Allocates a fresh, never-used address.
     */
    public Address newAccount() {
        return Address.fromLong(addressSequence.getAndIncrement());
    }

    /**
     * Adds a component whose state must follow checkpoints and reverts.
     */
    public synchronized void journal(Journaled component) {
        if (component == null) {
            throw new IllegalArgumentException("component cannot be null");
        }
        journaled.add(component);
    }

    // ========== StateJournal ==========

    @Override
    public synchronized Checkpoint checkpoint() {
        long sequence = checkpointSequence.incrementAndGet();
        List<Object> states = new ArrayList<>(journaled.size());
        for (Journaled component : journaled) {
            states.add(component.captureState());
        }
        checkpoints.put(sequence, states);
        return new Checkpoint(sequence);
    }

    @Override
    public synchronized void revertTo(Checkpoint checkpoint) {
        List<Object> states = checkpoints.get(checkpoint.sequence());
        if (states == null) {
            throw new IllegalStateException("unknown or released checkpoint: " + checkpoint);
        }
        for (int i = 0; i < states.size(); i++) {
            journaled.get(i).restoreState(states.get(i));
        }
        checkpoints.tailMap(checkpoint.sequence(), true).clear();
        log.debug("Reverted world to checkpoint {}", checkpoint.sequence());
    }

    @Override
    public synchronized void release(Checkpoint checkpoint) {
        checkpoints.remove(checkpoint.sequence());
    }

    /**
     * @return number of checkpoints not yet released or reverted
     */
    public synchronized int openCheckpoints() {
        return checkpoints.size();
    }

    // ========== components ==========

    public Clock clock() {
        return clock;
    }

    public Address admin() {
        return admin;
    }

    public InMemoryAssetLedger ledger() {
        return ledger;
    }

    public InMemoryWrappedNative wrappedNative() {
        return wrappedNative;
    }

    public InMemoryPoolDirectory pools() {
        return pools;
    }

    public InMemoryPositionManager positionManager() {
        return positionManager;
    }

    public InMemorySwapRouter swapRouter() {
        return swapRouter;
    }

    public InMemoryManagerRegistry registry() {
        return registry;
    }

    public InMemoryEventLog eventLog() {
        return eventLog;
    }
}
