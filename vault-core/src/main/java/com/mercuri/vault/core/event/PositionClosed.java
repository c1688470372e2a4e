package com.mercuri.vault.core.event;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PositionId;
import com.mercuri.vault.core.model.TokenAmounts;

/**
 * 포지션 종료 알림.
 *
 * @param vault Vault 주소
 * @param positionId 종료된 포지션
 * @param principal 해체 후 회수된 원금 (수수료 미적용)
 */
public record PositionClosed(Address vault, PositionId positionId, TokenAmounts principal) implements VaultEvent {
}
