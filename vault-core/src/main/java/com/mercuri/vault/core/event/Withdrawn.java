package com.mercuri.vault.core.event;

import com.mercuri.vault.core.model.Address;

import java.math.BigInteger;

/**
 * 토큰 출금 알림.
 *
 * @param vault Vault 주소
 * @param token 출금 토큰
 * @param to 수령자 (항상 Owner)
 * @param amount 출금 수량
 */
public record Withdrawn(Address vault, Address token, Address to, BigInteger amount) implements VaultEvent {
}
