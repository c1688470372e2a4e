package com.mercuri.vault.runtime;

import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.spi.ExactInputSingleParams;
import com.mercuri.vault.core.spi.SwapEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Vault 토큰 간 스왑 게이트.
 *
 * <ul>
 *   <li>수신자 == Vault 자신</li>
 *   <li>tokenIn / tokenOut == Vault의 두 토큰 (서로 다름, 외부 자산 경유 불가)</li>
 *   <li>스왑 엔진 승인: 0으로 초기화 → amountIn 정확히 설정 → 스왑 후 0</li>
 * </ul>
 */
final class RebalanceGate {

    private static final Logger log = LoggerFactory.getLogger(RebalanceGate.class);

    private final VaultBinding binding;
    private final ExactAllowance allowance;

    RebalanceGate(VaultBinding binding) {
        this.binding = binding;
        this.allowance = new ExactAllowance(binding.collaborators().tokens(), binding.address());
    }

    BigInteger rebalance(ExactInputSingleParams params) {
        if (!params.recipient().equals(binding.address())) {
            throw VaultException.invalidReference("swap recipient must be the vault itself (current: " + params.recipient() + ")");
        }
        if (!binding.poolKey().pair().isPairOf(params.tokenIn(), params.tokenOut())) {
            throw VaultException.invalidReference(String.format(
                "swap must pair the vault tokens %s/%s (requested: %s -> %s)",
                binding.token0(), binding.token1(), params.tokenIn(), params.tokenOut()));
        }

        SwapEngine swapEngine = binding.collaborators().swapEngine();
        allowance.grant(params.tokenIn(), swapEngine.address(), params.amountIn());
        BigInteger amountOut = swapEngine.exactInputSingle(binding.address(), params);
        allowance.revoke(params.tokenIn(), swapEngine.address());

        log.info("Rebalanced {} {} -> {} {}", params.amountIn(), params.tokenIn(), amountOut, params.tokenOut());
        return amountOut;
    }
}
