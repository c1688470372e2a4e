package com.mercuri.vault.core.event;

import com.mercuri.vault.core.model.Address;

import java.math.BigInteger;

/**
 * Owner 입금 알림.
 *
 * @param vault Vault 주소
 * @param token 입금 토큰
 * @param amount 입금 수량
 */
public record Deposited(Address vault, Address token, BigInteger amount) implements VaultEvent {
}
