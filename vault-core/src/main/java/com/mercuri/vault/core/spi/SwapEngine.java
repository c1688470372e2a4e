package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.model.Address;

import java.math.BigInteger;

/**
 * Single-hop swap router SPI.
 *
 * <p>The router pulls {@code amountIn} of {@code tokenIn} from the caller through the allowance granted
 * to {@link #address()} and pays {@code tokenOut} to the recipient. It may refund unused native currency
 * to the caller, which the vault receives through {@link NativeReceiver}.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public interface SwapEngine {

    Address address();

    /**
     * Swaps an exact input amount.
     *
     * @param caller account paying tokenIn
     * @param params swap parameters
     * @return tokenOut amount paid to the recipient
     * @throws com.mercuri.vault.core.error.VaultException SLIPPAGE_VIOLATION if the output is below the minimum
     */
    BigInteger exactInputSingle(Address caller, ExactInputSingleParams params);
}
