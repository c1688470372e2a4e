package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;

import java.math.BigInteger;

/**
 * Hook invoked when an account receives native currency.
 *
 * <p>Throwing from this method rejects the receipt.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface NativeReceiver {

    void receiveNative(Address sender, BigInteger amount);
}
