package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;

import java.math.BigInteger;

/**
 * Fungible token balance SPI (one ledger for every token, keyed by token address).
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public interface TokenLedger {

    BigInteger balanceOf(Address token, Address account);

    /**
     * Moves {@code amount} of {@code token} from {@code from} (the acting account) to {@code to}.
     *
     * @throws IllegalStateException if the balance is insufficient
     */
    void transfer(Address token, Address from, Address to, BigInteger amount);

    /**
     * Sets the allowance of {@code spender} over {@code owner}'s balance to exactly {@code amount}.
     */
    void approve(Address token, Address owner, Address spender, BigInteger amount);

    BigInteger allowance(Address token, Address owner, Address spender);

    /**
     * Moves {@code amount} from {@code from} to {@code to}, spending {@code spender}'s allowance.
     *
     * @throws IllegalStateException if the allowance or balance is insufficient
     */
    void transferFrom(Address token, Address spender, Address from, Address to, BigInteger amount);
}
