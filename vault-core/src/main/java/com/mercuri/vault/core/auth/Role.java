package com.mercuri.vault.core.auth;

/**
 * 호출자 분류 결과.
 *
 * <p>Owner와 Manager는 서로 다른 판정 규칙을 가진 별개의 역할입니다.</p>
 * <ul>
 *   <li>OWNER: 모든 작업에 무조건 허용</li>
 *   <li>MANAGER: {@link OperationClass#DELEGATED} 작업에만 허용 (레지스트리 실시간 승인 필요)</li>
 *   <li>DENIED: 어떤 작업도 허용되지 않음</li>
 * </ul>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public enum Role {

    OWNER,

    MANAGER,

    DENIED;

    /**
     * 역할이 작업 등급을 수행할 수 있는지 확인.
     *
     * @param operationClass 작업 등급
     * @return 허용 여부
     */
    public boolean permits(OperationClass operationClass) {
        if (operationClass == null) {
            throw new IllegalArgumentException("operationClass cannot be null");
        }
        return switch (this) {
            case OWNER -> true;
            case MANAGER -> operationClass == OperationClass.DELEGATED;
            case DENIED -> false;
        };
    }
}
