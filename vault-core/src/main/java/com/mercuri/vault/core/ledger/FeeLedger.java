package com.mercuri.vault.core.ledger;

import com.mercuri.vault.core.model.TokenAmounts;

/**
 * 수수료/원금 분리 장부.
 *
 * <p>엔진에서 회수된 금액을 스왑 수수료 수입과 원금으로 나눠 기록합니다.
 * 성과 수수료는 {@link #accruedFees()}에만 부과되며 원금에는 절대 부과되지 않습니다.</p>
 *
 * <p><strong>두 개의 잔고:</strong></p>
 * <ul>
 *   <li><strong>accruedFees:</strong> collect-while-active로 회수되었으나 아직 수수료가 적용되지 않은 수입.
 *       최상위 작업의 시작과 끝에서 항상 0입니다.</li>
 *   <li><strong>owedPrincipal:</strong> 부분 decrease로 엔진의 미수령 잔고에 옮겨졌지만 아직 회수되지 않은 원금.
 *       이후의 collect 수령액에서 먼저 차감되어 수수료 기준에서 제외됩니다.</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> 동기화하지 않습니다. Vault의 단일 실행 보장 하에서만 사용됩니다.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public final class FeeLedger {

    private TokenAmounts accruedFees = TokenAmounts.ZERO;
    private TokenAmounts owedPrincipal = TokenAmounts.ZERO;

    /**
     * 부분 decrease로 미수령 잔고에 옮겨진 원금 기록.
     *
     * @param released decreaseLiquidity가 반환한 원금
     */
    public void recordPrincipal(TokenAmounts released) {
        requireNonNull(released, "released");
        owedPrincipal = owedPrincipal.plus(released);
    }

    /**
     * collect 수령액을 원금과 수입으로 분리하여 장부에 반영.
     *
     * <p>수령액 중 owedPrincipal에 해당하는 부분은 원금으로 소진되고, 나머지가 수입입니다.
     * 수입은 collect 직전에 유동성이 0보다 컸던 경우에만 수수료 기준에 적립됩니다.</p>
     *
     * @param proceeds collect 수령액
     * @param liquidityObserved collect 직전 유동성이 0보다 컸는지 여부
     * @return 이번에 적립된 수입 (적립되지 않았으면 ZERO)
     */
    public TokenAmounts creditCollected(TokenAmounts proceeds, boolean liquidityObserved) {
        requireNonNull(proceeds, "proceeds");
        TokenAmounts principalPart = proceeds.min(owedPrincipal);
        owedPrincipal = owedPrincipal.saturatingMinus(principalPart);
        TokenAmounts income = proceeds.saturatingMinus(principalPart);
        if (!liquidityObserved || income.isZero()) {
            return TokenAmounts.ZERO;
        }
        accruedFees = accruedFees.plus(income);
        return income;
    }

    /**
     * 해체 후 collect 수령액을 원금으로 정산. 수수료 기준에 적립하지 않습니다.
     *
     * @param proceeds collect 수령액
     */
    public void settlePrincipal(TokenAmounts proceeds) {
        requireNonNull(proceeds, "proceeds");
        owedPrincipal = owedPrincipal.saturatingMinus(proceeds);
    }

    /**
     * 적립된 수입을 꺼내고 0으로 초기화.
     *
     * @return 수수료 적용 대상 금액
     */
    public TokenAmounts drain() {
        TokenAmounts drained = accruedFees;
        accruedFees = TokenAmounts.ZERO;
        return drained;
    }

    /**
     * 포지션 소각 시 원금 기록 초기화.
     */
    public void clearPrincipal() {
        owedPrincipal = TokenAmounts.ZERO;
    }

    public TokenAmounts accruedFees() {
        return accruedFees;
    }

    public TokenAmounts owedPrincipal() {
        return owedPrincipal;
    }

    public LedgerSnapshot snapshot() {
        return new LedgerSnapshot(accruedFees, owedPrincipal);
    }

    public void restore(LedgerSnapshot snapshot) {
        requireNonNull(snapshot, "snapshot");
        this.accruedFees = snapshot.accruedFees();
        this.owedPrincipal = snapshot.owedPrincipal();
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
