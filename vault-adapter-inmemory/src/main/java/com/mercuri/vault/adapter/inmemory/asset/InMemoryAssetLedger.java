package com.mercuri.vault.adapter.inmemory.asset;

import com.mercuri.vault.adapter.inmemory.world.Journaled;
import com.mercuri.vault.core.model.Address;
import com.mercuri.vault.core.spi.NativeCurrency;
import com.mercuri.vault.core.spi.NativeReceiver;
import com.mercuri.vault.core.spi.TokenLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link TokenLedger} and {@link NativeCurrency} for testing and reference purposes.
 *
 * <p>One ledger holds every token balance, every allowance and every native balance of the simulated world.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>tokenBalances:</strong> (token, account) → balance</li>
 *   <li><strong>allowances:</strong> (token, owner, spender) → allowance</li>
 *   <li><strong>nativeBalances:</strong> account → native balance</li>
 *   <li><strong>receivers:</strong> account → {@link NativeReceiver} hook (not journaled)</li>
 * </ul>
 *
 * <p><strong>Native receipt hooks:</strong> a transfer to an account with a registered receiver invokes the hook
 * after crediting. If the hook throws, the transfer is undone and {@link #send} returns false.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Coarse-grained locking (every method synchronized)</li>
 *   <li>No events, no decimals, no fee-on-transfer tokens</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Mercuri Vault Team
 * @since 1.0.0
 */
public class InMemoryAssetLedger implements TokenLedger, NativeCurrency, Journaled {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAssetLedger.class);

    private Map<BalanceKey, BigInteger> tokenBalances = new HashMap<>();
    private Map<AllowanceKey, BigInteger> allowances = new HashMap<>();
    private Map<Address, BigInteger> nativeBalances = new HashMap<>();
    private final Map<Address, NativeReceiver> receivers = new ConcurrentHashMap<>();

    // ========== TokenLedger ==========

    @Override
    public synchronized BigInteger balanceOf(Address token, Address account) {
        requireNonNull(token, "token");
        requireNonNull(account, "account");
        return tokenBalances.getOrDefault(new BalanceKey(token, account), BigInteger.ZERO);
    }

    @Override
    public synchronized void transfer(Address token, Address from, Address to, BigInteger amount) {
        requireNonNull(to, "to");
        requireAmount(amount);
        debit(token, from, amount);
        credit(token, to, amount);
    }

    @Override
    public synchronized void approve(Address token, Address owner, Address spender, BigInteger amount) {
        requireNonNull(token, "token");
        requireNonNull(owner, "owner");
        requireNonNull(spender, "spender");
        requireAmount(amount);
        AllowanceKey key = new AllowanceKey(token, owner, spender);
        if (amount.signum() == 0) {
            allowances.remove(key);
        } else {
            allowances.put(key, amount);
        }
    }

    @Override
    public synchronized BigInteger allowance(Address token, Address owner, Address spender) {
        return allowances.getOrDefault(new AllowanceKey(token, owner, spender), BigInteger.ZERO);
    }

    @Override
    public synchronized void transferFrom(Address token, Address spender, Address from, Address to, BigInteger amount) {
        requireNonNull(to, "to");
        requireAmount(amount);
        BigInteger allowed = allowance(token, from, spender);
        if (allowed.compareTo(amount) < 0) {
            throw new IllegalStateException(
                String.format("insufficient allowance of %s for spender %s over %s (allowed: %s, requested: %s)",
                    token, spender, from, allowed, amount));
        }
        debit(token, from, amount);
        credit(token, to, amount);
        approve(token, from, spender, allowed.subtract(amount));
    }

    // ========== NativeCurrency ==========

    @Override
    public synchronized BigInteger balanceOf(Address account) {
        requireNonNull(account, "account");
        return nativeBalances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized boolean send(Address from, Address to, BigInteger amount) {
        requireNonNull(from, "from");
        requireNonNull(to, "to");
        requireAmount(amount);
        BigInteger available = balanceOf(from);
        if (available.compareTo(amount) < 0) {
            log.debug("Native send {} -> {} of {} failed: balance {}", from, to, amount, available);
            return false;
        }
        nativeBalances.put(from, available.subtract(amount));
        nativeBalances.put(to, balanceOf(to).add(amount));

        NativeReceiver receiver = receivers.get(to);
        if (receiver == null) {
            return true;
        }
        try {
            receiver.receiveNative(from, amount);
            return true;
        } catch (RuntimeException e) {
            nativeBalances.put(to, balanceOf(to).subtract(amount));
            nativeBalances.put(from, balanceOf(from).add(amount));
            log.debug("Native receipt of {} from {} rejected by {}: {}", amount, from, to, e.getMessage());
            return false;
        }
    }

    // ========== Simulation helpers ==========

    /**
     * Creates {@code amount} of {@code token} out of thin air.
     */
    public synchronized void mint(Address token, Address to, BigInteger amount) {
        requireAmount(amount);
        credit(token, to, amount);
    }

    /**
     * Destroys {@code amount} of {@code token} held by {@code from}.
     *
     * @throws IllegalStateException if the balance is insufficient
     */
    public synchronized void burn(Address token, Address from, BigInteger amount) {
        requireAmount(amount);
        debit(token, from, amount);
    }

    /**
     * Creates native currency out of thin air.
     */
    public synchronized void mintNative(Address to, BigInteger amount) {
        requireNonNull(to, "to");
        requireAmount(amount);
        nativeBalances.put(to, balanceOf(to).add(amount));
    }

    /**
     * Registers a hook invoked whenever {@code account} receives native currency.
     */
    public void registerReceiver(Address account, NativeReceiver receiver) {
        requireNonNull(account, "account");
        requireNonNull(receiver, "receiver");
        receivers.put(account, receiver);
    }

    // ========== Journaled ==========

    @Override
    public synchronized Object captureState() {
        return new State(new HashMap<>(tokenBalances), new HashMap<>(allowances), new HashMap<>(nativeBalances));
    }

    @Override
    public synchronized void restoreState(Object state) {
        State captured = (State) state;
        this.tokenBalances = new HashMap<>(captured.tokenBalances());
        this.allowances = new HashMap<>(captured.allowances());
        this.nativeBalances = new HashMap<>(captured.nativeBalances());
    }

    // ========== internals ==========

    private void debit(Address token, Address from, BigInteger amount) {
        requireNonNull(token, "token");
        requireNonNull(from, "from");
        BalanceKey key = new BalanceKey(token, from);
        BigInteger balance = tokenBalances.getOrDefault(key, BigInteger.ZERO);
        if (balance.compareTo(amount) < 0) {
            throw new IllegalStateException(
                String.format("insufficient %s balance of %s (balance: %s, requested: %s)", token, from, balance, amount));
        }
        tokenBalances.put(key, balance.subtract(amount));
    }

    private void credit(Address token, Address to, BigInteger amount) {
        requireNonNull(token, "token");
        requireNonNull(to, "to");
        tokenBalances.merge(new BalanceKey(token, to), amount, BigInteger::add);
    }

    private static void requireAmount(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be non-negative (current: " + amount + ")");
        }
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    private record BalanceKey(Address token, Address account) {
    }

    private record AllowanceKey(Address token, Address owner, Address spender) {
    }

    private record State(
        Map<BalanceKey, BigInteger> tokenBalances,
        Map<AllowanceKey, BigInteger> allowances,
        Map<Address, BigInteger> nativeBalances
    ) {
    }
}
