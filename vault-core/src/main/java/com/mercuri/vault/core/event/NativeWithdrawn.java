package com.mercuri.vault.core.event;

import com.mercuri.vault.core.model.Address;

import java.math.BigInteger;

/**
 * 네이티브 자산 출금 알림 (wrapped 자산 언랩 후 전송).
 *
 * @param vault Vault 주소
 * @param to 수령자 (항상 Owner)
 * @param amount 출금 수량
 */
public record NativeWithdrawn(Address vault, Address to, BigInteger amount) implements VaultEvent {
}
