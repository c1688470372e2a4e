/**
 * Vault notifications.
 *
 * <p>Notifications are emitted to a {@link com.mercuri.vault.core.spi.VaultEventListener} when the
 * operation that produced them commits. They are observability only and never consumed by the vault.</p>
 *
 * @since 1.0.0
 * @author Mercuri Vault Team
 */
package com.mercuri.vault.core.event;
