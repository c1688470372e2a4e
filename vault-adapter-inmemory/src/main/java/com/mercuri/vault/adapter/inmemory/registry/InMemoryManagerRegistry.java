package com.mercuri.vault.adapter.inmemory.registry;

import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.spi.ManagerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory global manager approval list.
 *
 * <p>Only the registry admin may change approvals. Vaults query {@link #isApproved} on every
 * delegated call, so a revocation here takes effect on the very next call.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public class InMemoryManagerRegistry implements ManagerRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryManagerRegistry.class);

    private final Address admin;
    private final Set<Address> approved = ConcurrentHashMap.newKeySet();

    public InMemoryManagerRegistry(Address admin) {
        if (admin == null || admin.isZero()) {
            throw new IllegalArgumentException("admin cannot be null or the zero address");
        }
        this.admin = admin;
    }

    @Override
    public boolean isApproved(Address manager) {
        return manager != null && approved.contains(manager);
    }

    /**
     * Approves or revokes a manager.
     *
     * @throws VaultException UNAUTHORIZED if {@code caller} is not the admin
     */
    public void setApproved(Address caller, Address manager, boolean isApproved) {
        if (!admin.equals(caller)) {
            throw VaultException.unauthorized("only the registry admin may change approvals (caller: " + caller + ")");
        }
        if (manager == null || manager.isZero()) {
            throw new IllegalArgumentException("manager cannot be null or the zero address");
        }
        if (isApproved) {
            approved.add(manager);
        } else {
            approved.remove(manager);
        }
        log.info("Manager {} {}", manager, isApproved ? "approved" : "revoked");
    }

    public Address admin() {
        return admin;
    }
}
