package com.mercuri.vault.runtime;

import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.model.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * 네이티브 자산 수신 가드.
 *
 * <p>신뢰하는 두 발신자만 허용합니다.</p>
 * <ul>
 *   <li>wrapped 자산 컨트랙트: 언랩 완료 (그대로 수령)</li>
 *   <li>스왑 엔진: 스왑 환불. 즉시 다시 wrap 합니다. Vault 토큰 중 wrapped 자산이 없으면 거부 (INVALID_REFERENCE)</li>
 *   <li>그 외 발신자: 거부 (UNAUTHORIZED)</li>
 * </ul>
 *
 * <p>수신은 보호된 작업 도중에 발생하므로 ReentrancyGuard를 거치지 않습니다.</p>
 */
final class NativeReceiptGuard {

    private static final Logger log = LoggerFactory.getLogger(NativeReceiptGuard.class);

    private final VaultBinding binding;

    NativeReceiptGuard(VaultBinding binding) {
        this.binding = binding;
    }

    void accept(Address sender, BigInteger amount) {
        if (sender == null || amount == null) {
            throw new IllegalArgumentException("sender and amount cannot be null");
        }
        Address wrapped = binding.collaborators().wrappedNative().address();

        if (sender.equals(wrapped)) {
            log.debug("Received {} native from unwrap", amount);
            return;
        }

        if (sender.equals(binding.collaborators().swapEngine().address())) {
            if (!binding.poolKey().pair().contains(wrapped)) {
                throw VaultException.invalidReference("swap refund rejected: vault pair holds no wrapped native asset");
            }
            if (amount.signum() > 0) {
                binding.collaborators().wrappedNative().deposit(binding.address(), amount);
            }
            log.debug("Re-wrapped {} native refunded by swap engine", amount);
            return;
        }

        throw VaultException.unauthorized("native receipt from untrusted sender " + sender);
    }
}
