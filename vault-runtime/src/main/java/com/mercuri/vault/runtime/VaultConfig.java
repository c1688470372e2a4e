package com.mercuri.vault.runtime;

import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.model.Address;

/**
 * Vault 생성 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>address: Vault 자신의 계정 주소 (불변)</li>
 *   <li>owner: 소유자 (불변, 영 주소 불가)</li>
 *   <li>manager: 초기 Manager ({@link Address#ZERO}이면 위임 없음)</li>
 *   <li>pool: 바인딩할 풀 (불변). 토큰 쌍과 수수료 등급은 생성 시 풀에서 읽습니다.</li>
 *   <li>unwrapNative: wrapped 네이티브 자산 출금 시 언랩 여부 (기본 false)</li>
 * </ul>
 *
 * <p>설정 오류는 생성 시점에 치명적이며 Vault가 만들어지지 않습니다.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 * @param address Vault 주소
 * @param owner 소유자
 * @param manager 초기 Manager
 * @param pool 바인딩할 풀
 * @param unwrapNative 언랩 여부
 */
public record VaultConfig(Address address, Address owner, Address manager, Address pool, boolean unwrapNative) {

    /**
     * 언랩 비활성 기본 설정 생성자.
     */
    public VaultConfig(Address address, Address owner, Address manager, Address pool) {
        this(address, owner, manager, pool, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws VaultException CONFIGURATION_ERROR - 필수 주소가 null이거나 영 주소인 경우
     */
    public VaultConfig {
        requireNonZero(address, "address");
        requireNonZero(owner, "owner");
        requireNonZero(pool, "pool");
        if (manager == null) {
            throw VaultException.configuration("manager cannot be null (use Address.ZERO for no manager)");
        }
    }

    /**
     * manager만 변경한 새 인스턴스 생성.
     *
     * @param manager 새 Manager
     * @return 새 VaultConfig 인스턴스
     */
    public VaultConfig withManager(Address manager) {
        return new VaultConfig(address, owner, manager, pool, unwrapNative);
    }

    /**
     * unwrapNative만 변경한 새 인스턴스 생성.
     *
     * @param unwrapNative 언랩 여부
     * @return 새 VaultConfig 인스턴스
     */
    public VaultConfig withUnwrapNative(boolean unwrapNative) {
        return new VaultConfig(address, owner, manager, pool, unwrapNative);
    }

    private static void requireNonZero(Address value, String name) {
        if (value == null || value.isZero()) {
            throw VaultException.configuration(name + " cannot be null or the zero address");
        }
    }
}
