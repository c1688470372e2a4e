package com.mercuri.vault.adapter.inmemory.factory;

import com.mercuri.vault.adapter.inmemory.world.InMemoryWorld;
import com.mercuri.vault.application.vault.Vault;
import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.spi.ProtocolFeeSource;
import com.mercuri.vault.core.spi.ProtocolFees;
import com.mercuri.vault.runtime.ConcentratedLiquidityVault;
import com.mercuri.vault.runtime.VaultCollaborators;
import com.mercuri.vault.runtime.VaultConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory vault factory and protocol fee authority.
 *
 * <p>Deploys {@link ConcentratedLiquidityVault} instances wired to an {@link InMemoryWorld},
 * registers each one as a native receiver on the world ledger, and answers
 * {@link #protocolFees()} with the live admin-set values.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public class InMemoryVaultFactory implements ProtocolFeeSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVaultFactory.class);

    private final InMemoryWorld world;
    private final FactoryConfig config;
    private final Map<Address, List<Vault>> vaultsByOwner = new ConcurrentHashMap<>();
    private volatile ProtocolFees protocolFees;

    public InMemoryVaultFactory(InMemoryWorld world, FactoryConfig config) {
        if (world == null || config == null) {
            throw new IllegalArgumentException("world and config cannot be null");
        }
        this.world = world;
        this.config = config;
        this.protocolFees = config.initialFees();
    }

    @Override
    public ProtocolFees protocolFees() {
        return protocolFees;
    }

    /**
     * Sets the protocol performance fee.
     *
     * @throws VaultException UNAUTHORIZED if {@code caller} is not the admin
     * @throws VaultException CONFIGURATION_ERROR if the fee exceeds the ceiling or the recipient is the zero address
     */
    public void setProtocolFees(Address caller, int feeBps, Address recipient) {
        if (!config.admin().equals(caller)) {
            throw VaultException.unauthorized("only the factory admin may set protocol fees (caller: " + caller + ")");
        }
        if (feeBps < 0 || feeBps > config.feeCeilingBps()) {
            throw VaultException.configuration(
                "fee " + feeBps + " bps outside the allowed range 0.." + config.feeCeilingBps());
        }
        if (recipient == null || recipient.isZero()) {
            throw VaultException.configuration("fee recipient cannot be the zero address");
        }
        this.protocolFees = new ProtocolFees(feeBps, recipient);
        log.info("Protocol fees set to {} bps for {}", feeBps, recipient);
    }

    /**
     * Deploys a vault for {@code owner} bound to {@code pool}.
     *
     * @param owner vault owner
     * @param manager initial manager, {@link Address#ZERO} for none
     * @param pool canonical pool address
     * @return the new vault
     */
    public Vault createVault(Address owner, Address manager, Address pool) {
        return createVault(new VaultConfig(world.newAccount(), owner, manager, pool));
    }

    public Vault createVault(VaultConfig vaultConfig) {
        ConcentratedLiquidityVault vault = ConcentratedLiquidityVault.create(vaultConfig, collaborators());
        world.ledger().registerReceiver(vault.address(), vault);
        vaultsByOwner.computeIfAbsent(vaultConfig.owner(), owner -> Collections.synchronizedList(new ArrayList<>()))
            .add(vault);
        log.info("Factory deployed vault {} for {}", vault.address(), vaultConfig.owner());
        return vault;
    }

    /**
     * Collaborators handed to every vault this factory deploys.
     */
    public VaultCollaborators collaborators() {
        return new VaultCollaborators(
            world.positionManager(),
            world.swapRouter(),
            world.registry(),
            this,
            world.wrappedNative(),
            world.ledger(),
            world.ledger(),
            world.pools(),
            world.eventLog(),
            world,
            world.clock()
        );
    }

    public List<Vault> vaultsOf(Address owner) {
        List<Vault> vaults = vaultsByOwner.get(owner);
        return vaults == null ? List.of() : List.copyOf(vaults);
    }

    public FactoryConfig config() {
        return config;
    }
}
