package com.mercuri.vault.core.spi;

/**
 * Protocol fee configuration source SPI.
 *
 * <p>Read live on every teardown and explicit collect. A configuration change takes effect
 * from the very next operation.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public interface ProtocolFeeSource {

    /**
     * @return current fee rate and recipient
     */
    ProtocolFees protocolFees();
}
