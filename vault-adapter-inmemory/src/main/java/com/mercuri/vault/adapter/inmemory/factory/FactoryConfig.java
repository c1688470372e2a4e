package com.mercuri.vault.adapter.inmemory.factory;

import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.spi.ProtocolFees;

/**
 * Configuration for {@link InMemoryVaultFactory}.
 *
 * <p><strong>Defaults:</strong></p>
 * <ul>
 *   <li>feeCeilingBps: {@value #DEFAULT_FEE_CEILING_BPS} (20%)</li>
 *   <li>initialFees: {@link ProtocolFees#none()}</li>
 * </ul>
 *
 * @param admin account allowed to change protocol fees
 * @param feeCeilingBps highest protocol fee the admin may set
 * @param initialFees protocol fees in force at construction
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public record FactoryConfig(Address admin, int feeCeilingBps, ProtocolFees initialFees) {

    public static final int DEFAULT_FEE_CEILING_BPS = 2_000;

    public FactoryConfig {
        if (admin == null || admin.isZero()) {
            throw VaultException.configuration("admin cannot be null or the zero address");
        }
        if (feeCeilingBps < 0 || feeCeilingBps > ProtocolFees.BPS_DENOMINATOR) {
            throw VaultException.configuration("feeCeilingBps must be between 0 and " + ProtocolFees.BPS_DENOMINATOR
                + " (current: " + feeCeilingBps + ")");
        }
        if (initialFees == null) {
            initialFees = ProtocolFees.none();
        }
        if (initialFees.feeBps() > feeCeilingBps) {
            throw VaultException.configuration("initial fee " + initialFees.feeBps() + " exceeds ceiling " + feeCeilingBps);
        }
    }

    public static FactoryConfig defaults(Address admin) {
        return new FactoryConfig(admin, DEFAULT_FEE_CEILING_BPS, ProtocolFees.none());
    }
}
