package com.mercuri.vault.core.error;

/**
 * Vault 작업 실패.
 *
 * <p>{@link VaultErrorCode}로 실패 사유를 구분합니다. 이 예외가 던져지면
 * 해당 작업에서 변경된 모든 상태는 호출 이전으로 되돌려집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try {
 *     vault.withdrawAll(caller);
 * } catch (VaultException e) {
 *     if (e.getErrorCode() == VaultErrorCode.UNAUTHORIZED) {
 *         // owner가 아닌 호출자
 *     }
 * }
 * }</pre>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public class VaultException extends RuntimeException {

    private final VaultErrorCode errorCode;

    public VaultException(VaultErrorCode errorCode, String message) {
        super(buildMessage(errorCode, message));
        this.errorCode = errorCode;
    }

    public VaultException(VaultErrorCode errorCode, String message, Throwable cause) {
        super(buildMessage(errorCode, message), cause);
        this.errorCode = errorCode;
    }

    public static VaultException unauthorized(String message) {
        return new VaultException(VaultErrorCode.UNAUTHORIZED, message);
    }

    public static VaultException invalidState(String message) {
        return new VaultException(VaultErrorCode.INVALID_STATE, message);
    }

    public static VaultException invalidReference(String message) {
        return new VaultException(VaultErrorCode.INVALID_REFERENCE, message);
    }

    public static VaultException slippage(String message) {
        return new VaultException(VaultErrorCode.SLIPPAGE_VIOLATION, message);
    }

    public static VaultException transferFailure(String message) {
        return new VaultException(VaultErrorCode.TRANSFER_FAILURE, message);
    }

    public static VaultException configuration(String message) {
        return new VaultException(VaultErrorCode.CONFIGURATION_ERROR, message);
    }

    public static VaultException reentrant(String message) {
        return new VaultException(VaultErrorCode.REENTRANT, message);
    }

    public VaultErrorCode getErrorCode() {
        return errorCode;
    }

    private static String buildMessage(VaultErrorCode errorCode, String message) {
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        return "[" + errorCode.code() + " " + errorCode.name() + "] " + message;
    }
}
