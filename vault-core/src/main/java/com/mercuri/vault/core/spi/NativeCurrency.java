package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;

import java.math.BigInteger;

/**
 * Native currency transfer SPI.
 *
 * <p>A transfer to an account that registered a {@link NativeReceiver} invokes the receiver;
 * a rejecting receiver makes the transfer fail without moving funds.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public interface NativeCurrency {

    BigInteger balanceOf(Address account);

    /**
     * Sends native currency.
     *
     * @param from sending account
     * @param to receiving account
     * @param amount amount to send
     * @return true if delivered, false if the receiver rejected it or the balance is insufficient
     */
    boolean send(Address from, Address to, BigInteger amount);
}
