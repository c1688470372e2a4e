package com.mercuri.vault.runtime;

import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.spi.TokenLedger;

import java.math.BigInteger;

/**
 * 호출 단위 정확 승인.
 *
 * <p>승인은 매 호출마다 0으로 초기화한 뒤 정확한 금액으로 설정하고, 호출 후 다시 0으로 되돌립니다.
 * 호출 사이에 남는 무제한 승인은 없습니다.</p>
 */
final class ExactAllowance {

    private final TokenLedger tokens;
    private final Address owner;

    ExactAllowance(TokenLedger tokens, Address owner) {
        this.tokens = tokens;
        this.owner = owner;
    }

    void grant(Address token, Address spender, BigInteger amount) {
        tokens.approve(token, owner, spender, BigInteger.ZERO);
        if (amount.signum() > 0) {
            tokens.approve(token, owner, spender, amount);
        }
    }

    void revoke(Address token, Address spender) {
        tokens.approve(token, owner, spender, BigInteger.ZERO);
    }
}
