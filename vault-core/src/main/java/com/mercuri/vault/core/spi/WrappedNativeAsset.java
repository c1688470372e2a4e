package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;

import java.math.BigInteger;

/**
 * Wrapped native asset contract SPI.
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public interface WrappedNativeAsset {

    /**
     * The wrapped token address (also the sender of unwrap completions).
     */
    Address address();

    /**
     * Wraps {@code amount} of the caller's native balance into the wrapped token.
     *
     * @param caller account sending native currency
     * @param amount amount to wrap
     */
    void deposit(Address caller, BigInteger amount);

    /**
     * Unwraps {@code amount} of the caller's wrapped balance and sends native currency back to the caller.
     *
     * @param caller account holding the wrapped token
     * @param amount amount to unwrap
     * @throws IllegalStateException if the native transfer back to the caller fails
     */
    void withdraw(Address caller, BigInteger amount);
}
