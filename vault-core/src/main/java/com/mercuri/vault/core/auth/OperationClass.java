package com.mercuri.vault.core.auth;

/**
 * 권한 판정을 위한 작업 등급.
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public enum OperationClass {

    /**
     * 위임 가능한 운영 작업 (mint, increase, decrease, collect, burn, close, rebalance).
     * Owner 또는 승인된 Manager 허용.
     */
    DELEGATED,

    /**
     * 자본 이동 및 설정 작업 (withdrawAll, deposit, setManager, setUnwrapNative).
     * Owner만 허용.
     */
    OWNER_ONLY
}
