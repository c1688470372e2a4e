package com.mercuri.vault.core.error;

/**
 * Vault 오류 분류.
 *
 * <p>모든 오류는 진행 중인 작업 전체를 원자적으로 되돌리며, 호출자에게
 * 구분 가능한 사유를 전달합니다. 자동 재시도는 없습니다.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public enum VaultErrorCode {

    /**
     * 권한 게이트 거부.
     */
    UNAUTHORIZED("VAULT-401"),

    /**
     * 잘못된 생명주기 상태에서 시도된 작업.
     */
    INVALID_STATE("VAULT-409"),

    /**
     * 포지션 ID, 토큰 쌍, 풀, 수신자 불일치.
     */
    INVALID_REFERENCE("VAULT-422"),

    /**
     * 최소 수령량 미충족 또는 슬리피지 보호 누락.
     */
    SLIPPAGE_VIOLATION("VAULT-412"),

    /**
     * Owner에게 네이티브 자산 전송 실패.
     */
    TRANSFER_FAILURE("VAULT-502"),

    /**
     * 설정 오류 (영 주소, 수수료 상한 초과 등). 생성 시점에 치명적.
     */
    CONFIGURATION_ERROR("VAULT-500"),

    /**
     * 보호된 작업에 대한 중첩 재진입.
     */
    REENTRANT("VAULT-423");

    private final String code;

    VaultErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
