package com.mercuri.vault.adapter.inmemory.asset;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.spi.WrappedNativeAsset;

import java.math.BigInteger;

/**
 * In-memory wrapped native asset contract.
 *
 * <p>The wrapped token lives in the shared {@link InMemoryAssetLedger} under {@link #address()};
 * the native backing is held by the same address.</p>
 *
 * <ul>
 *   <li><strong>deposit:</strong> caller's native → this contract, wrapped token minted to caller</li>
 *   <li><strong>withdraw:</strong> wrapped token burned from caller, native sent back (receiver hook runs)</li>
 * </ul>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public class InMemoryWrappedNative implements WrappedNativeAsset {

    private final Address address;
    private final InMemoryAssetLedger ledger;

    public InMemoryWrappedNative(Address address, InMemoryAssetLedger ledger) {
        if (address == null || address.isZero()) {
            throw new IllegalArgumentException("address cannot be null or the zero address");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        this.address = address;
        this.ledger = ledger;
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public void deposit(Address caller, BigInteger amount) {
        if (!ledger.send(caller, address, amount)) {
            throw new IllegalStateException("deposit of " + amount + " native from " + caller + " failed");
        }
        ledger.mint(address, caller, amount);
    }

    @Override
    public void withdraw(Address caller, BigInteger amount) {
        ledger.burn(address, caller, amount);
        if (!ledger.send(address, caller, amount)) {
            throw new IllegalStateException("native transfer of " + amount + " to " + caller + " failed");
        }
    }

    /**
     * Mints fully backed wrapped tokens (test funding helper).
     *
     * @param to recipient of the wrapped tokens
     * @param amount amount to mint
     */
    public void mintWrapped(Address to, BigInteger amount) {
        ledger.mintNative(address, amount);
        ledger.mint(address, to, amount);
    }
}
