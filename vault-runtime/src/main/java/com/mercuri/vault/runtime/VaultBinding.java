package com.mercuri.vault.runtime;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PoolKey;

import java.time.Clock;

/**
 * 생성 시 고정되는 Vault 바인딩.
 *
 * @param address Vault 주소
 * @param owner 소유자
 * @param pool 바인딩된 풀
 * @param poolKey 풀의 토큰 쌍과 수수료 등급
 * @param collaborators 외부 협력자
 */
record VaultBinding(Address address, Address owner, Address pool, PoolKey poolKey, VaultCollaborators collaborators) {

    Address token0() {
        return poolKey.token0();
    }

    Address token1() {
        return poolKey.token1();
    }

    /**
     * 엔진 호출 마감 시각 (현재 시각, epoch seconds).
     */
    long deadline() {
        Clock clock = collaborators.clock();
        return clock.instant().getEpochSecond();
    }
}
