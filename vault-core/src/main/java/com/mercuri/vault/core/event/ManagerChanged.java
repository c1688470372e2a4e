package com.mercuri.vault.core.event;

import com.mercuri.vault.core.model.Address;

/**
 * Manager 변경 알림.
 *
 * @param vault Vault 주소
 * @param newManager 새 Manager ({@link Address#ZERO}이면 위임 해제)
 */
public record ManagerChanged(Address vault, Address newManager) implements VaultEvent {
}
