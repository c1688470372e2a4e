package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PoolKey;

import java.util.Optional;

/**
 * Pool lookup SPI (the exchange factory).
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public interface PoolDirectory {

    /**
     * Reads the token pair and fee tier of a deployed pool.
     *
     * @param pool pool address
     * @return pool key, or empty if no pool lives at that address
     */
    Optional<PoolKey> poolKey(Address pool);

    /**
     * Resolves the canonical pool for a key.
     *
     * @param key token pair and fee tier
     * @return pool address, or {@link Address#ZERO} if none is deployed
     */
    Address getPool(PoolKey key);
}
