package com.mercuri.vault.adapter.inmemory.exchange;

import com.mercuri.vault.adapter.inmemory.asset.InMemoryAssetLedger;
import com.mercuri.vault.core.error.VaultException;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.model.PoolKey;
import com.mercuri.vault.core.model.TokenPair;
import com.mercuri.vault.core.spi.ExactInputSingleParams;
import com.mercuri.vault.core.spi.SwapEngine;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory single-pool swap router with fixed exchange rates.
 *
 * <p>Output tokens are paid from the router's own ledger balance, so tests must seed reserves with
 * {@link InMemoryAssetLedger#mint}. An optional native refund is sent back to the caller after each
 * swap, mimicking a router that returns unspent native currency.</p>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public class InMemorySwapRouter implements SwapEngine {

    private final Address address;
    private final InMemoryAssetLedger ledger;
    private final InMemoryPoolDirectory pools;
    private final Map<Direction, Rate> rates = new ConcurrentHashMap<>();
    private volatile BigInteger nativeRefund = BigInteger.ZERO;

    public InMemorySwapRouter(Address address, InMemoryAssetLedger ledger, InMemoryPoolDirectory pools) {
        if (address == null || ledger == null || pools == null) {
            throw new IllegalArgumentException("swap router dependencies cannot be null");
        }
        this.address = address;
        this.ledger = ledger;
        this.pools = pools;
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public BigInteger exactInputSingle(Address caller, ExactInputSingleParams params) {
        PoolKey key = new PoolKey(TokenPair.sorted(params.tokenIn(), params.tokenOut()), params.fee());
        if (pools.getPool(key).isZero()) {
            throw new IllegalArgumentException("pool not found: " + key);
        }
        Rate rate = rates.getOrDefault(new Direction(params.tokenIn(), params.tokenOut()), Rate.PAR);
        BigInteger amountOut = params.amountIn().multiply(rate.numerator()).divide(rate.denominator());
        if (amountOut.compareTo(params.amountOutMinimum()) < 0) {
            throw VaultException.slippage(
                "Too little received (amountOut: " + amountOut + ", minimum: " + params.amountOutMinimum() + ")");
        }
        ledger.transferFrom(params.tokenIn(), address, caller, address, params.amountIn());
        ledger.transfer(params.tokenOut(), address, params.recipient(), amountOut);

        BigInteger refund = nativeRefund;
        if (refund.signum() > 0 && !ledger.send(address, caller, refund)) {
            throw new IllegalStateException("native refund of " + refund + " to " + caller + " failed");
        }
        return amountOut;
    }

    /**
     * Sets the exchange rate for swaps from {@code tokenIn} to {@code tokenOut}: out = in * numerator / denominator.
     */
    public void setRate(Address tokenIn, Address tokenOut, long numerator, long denominator) {
        if (numerator < 0 || denominator <= 0) {
            throw new IllegalArgumentException("rate must be non-negative with a positive denominator");
        }
        rates.put(new Direction(tokenIn, tokenOut), new Rate(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator)));
    }

    /**
     * Native currency refunded to the caller after every swap. Zero disables refunds.
     */
    public void setNativeRefund(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("refund must be non-negative");
        }
        this.nativeRefund = amount;
    }

    private record Direction(Address tokenIn, Address tokenOut) {
    }

    private record Rate(BigInteger numerator, BigInteger denominator) {
        private static final Rate PAR = new Rate(BigInteger.ONE, BigInteger.ONE);
    }
}
