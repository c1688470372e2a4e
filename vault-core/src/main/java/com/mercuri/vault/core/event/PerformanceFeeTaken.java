package com.mercuri.vault.core.event;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.TokenAmounts;

/**
 * 성과 수수료 징수 알림.
 *
 * @param vault Vault 주소
 * @param recipient 수수료 수령자
 * @param feeBps 적용된 수수료율
 * @param feeBase 수수료 산정 기준 (스왑 수수료 수입)
 * @param fee 징수된 수수료
 */
public record PerformanceFeeTaken(
    Address vault,
    Address recipient,
    int feeBps,
    TokenAmounts feeBase,
    TokenAmounts fee
) implements VaultEvent {
}
