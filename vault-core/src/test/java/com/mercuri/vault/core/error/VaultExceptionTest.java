package com.mercuri.vault.core.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * VaultException 테스트.
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
class VaultExceptionTest {

    @Test
    void message_에_코드와_이름_포함() {
        VaultException exception = VaultException.slippage("min not met");

        assertEquals(VaultErrorCode.SLIPPAGE_VIOLATION, exception.getErrorCode());
        assertEquals("[VAULT-412 SLIPPAGE_VIOLATION] min not met", exception.getMessage());
    }

    @Test
    void factory_메서드별_코드() {
        assertEquals(VaultErrorCode.UNAUTHORIZED, VaultException.unauthorized("x").getErrorCode());
        assertEquals(VaultErrorCode.INVALID_STATE, VaultException.invalidState("x").getErrorCode());
        assertEquals(VaultErrorCode.INVALID_REFERENCE, VaultException.invalidReference("x").getErrorCode());
        assertEquals(VaultErrorCode.TRANSFER_FAILURE, VaultException.transferFailure("x").getErrorCode());
        assertEquals(VaultErrorCode.CONFIGURATION_ERROR, VaultException.configuration("x").getErrorCode());
        assertEquals(VaultErrorCode.REENTRANT, VaultException.reentrant("x").getErrorCode());
    }

    @Test
    void 코드는_서로_구분됨() {
        long distinct = java.util.Arrays.stream(VaultErrorCode.values()).map(VaultErrorCode::code).distinct().count();

        assertEquals(VaultErrorCode.values().length, distinct);
    }

    @Test
    void cause_보존() {
        IllegalStateException cause = new IllegalStateException("engine");

        VaultException exception = new VaultException(VaultErrorCode.TRANSFER_FAILURE, "send failed", cause);

        assertSame(cause, exception.getCause());
    }

    @Test
    void 빈_메시지는_예외() {
        assertThrows(IllegalArgumentException.class, () -> VaultException.unauthorized(" "));
        assertThrows(IllegalArgumentException.class, () -> new VaultException(null, "x"));
    }
}
