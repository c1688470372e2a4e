package com.mercuri.vault.core.spi;

import com.mercuri.vault.core.event.VaultEvent;

/**
 * Notification sink SPI.
 *
 * <p>Notifications are observability only; the vault never reads them back.
 * Events are delivered when the owning operation commits.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface VaultEventListener {

    void onEvent(VaultEvent event);
}
