package com.mercuri.vault.adapter.inmemory.exchange;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PoolKey;
import com.mercuri.vault.core.spi.PoolDirectory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory pool registry: the canonical (token0, token1, fee) → pool mapping and its reverse.
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public class InMemoryPoolDirectory implements PoolDirectory {

    private final Map<PoolKey, Address> poolsByKey = new ConcurrentHashMap<>();
    private final Map<Address, PoolKey> keysByPool = new ConcurrentHashMap<>();

    /**
     * Registers a pool under its canonical key.
     *
     * @throws IllegalStateException if the key or the pool address is already registered
     */
    public synchronized void register(PoolKey key, Address pool) {
        if (key == null || pool == null || pool.isZero()) {
            throw new IllegalArgumentException("key and pool cannot be null or the zero address");
        }
        if (poolsByKey.containsKey(key) || keysByPool.containsKey(pool)) {
            throw new IllegalStateException("pool already registered: " + key + " / " + pool);
        }
        poolsByKey.put(key, pool);
        keysByPool.put(pool, key);
    }

    @Override
    public Optional<PoolKey> poolKey(Address pool) {
        if (pool == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keysByPool.get(pool));
    }

    @Override
    public Address getPool(PoolKey key) {
        if (key == null) {
            return Address.ZERO;
        }
        return poolsByKey.getOrDefault(key, Address.ZERO);
    }
}
