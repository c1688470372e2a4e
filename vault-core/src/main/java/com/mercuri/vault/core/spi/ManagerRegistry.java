package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;

/**
 * Advisory manager registry SPI.
 *
 * <p>Queried live on every manager-gated call. Implementations must return the current approval,
 * and callers must never cache the answer beyond the current call.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public interface ManagerRegistry {

    /**
     * @param manager manager identity
     * @return true if the manager is approved right now
     */
    boolean isApproved(Address manager);
}
