/*
 * Copyright 2026 copayj contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.copayj.wallet;

import org.bitcoinj.core.Utils;
import org.bitcoinj.utils.Threading;
import org.copayj.core.CopayException;
import org.copayj.core.Defaults;
import org.copayj.core.WalletBusyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.GuardedBy;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>Per wallet advisory locks. Coin selection and proposal mutation for one wallet must not run
 * concurrently, otherwise two proposals could select the same inputs.</p>
 *
 * <p>A caller waits at most {@code waitTimeMillis} for a wallet and then fails with
 * {@link WalletBusyException}. A granted lease expires after {@code leaseTimeMillis}, measured with
 * {@link Utils#currentTimeMillis()}, so a holder that never releases cannot block the wallet forever.
 * Different wallets never contend.</p>
 */
public class WalletLockManager {
    private static final Logger log = LoggerFactory.getLogger(WalletLockManager.class);

    private final ReentrantLock lock = Threading.lock("WalletLockManager");
    private final Condition released = lock.newCondition();

    @GuardedBy("lock")
    private final Map<String, Lease> leases = new HashMap<>();

    private final long waitTimeMillis;
    private final long leaseTimeMillis;

    public WalletLockManager() {
        this(Defaults.LOCK_WAIT_TIME, Defaults.LOCK_EXE_TIME);
    }

    public WalletLockManager(long waitTimeMillis, long leaseTimeMillis) {
        checkArgument(waitTimeMillis >= 0, "negative wait time");
        checkArgument(leaseTimeMillis > 0, "lease time must be positive");
        this.waitTimeMillis = waitTimeMillis;
        this.leaseTimeMillis = leaseTimeMillis;
    }

    /**
     * Acquires the lock of a wallet. Release it by closing the returned lease, typically with
     * try-with-resources.
     */
    public Lease acquire(String walletId) throws WalletBusyException {
        checkNotNull(walletId);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(waitTimeMillis);
        lock.lock();
        try {
            while (true) {
                Lease current = leases.get(walletId);
                if (current == null || current.isExpired()) {
                    if (current != null)
                        log.warn("Lease on wallet {} expired, taking over", walletId);
                    Lease lease = new Lease(walletId, Utils.currentTimeMillis() + leaseTimeMillis);
                    leases.put(walletId, lease);
                    return lease;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.info("Wallet {} is busy", walletId);
                    throw new WalletBusyException(walletId);
                }
                // Wake up at the latest when the current lease expires.
                long untilExpiry = TimeUnit.MILLISECONDS.toNanos(Math.max(1, current.expiresAt - Utils.currentTimeMillis()));
                released.awaitNanos(Math.min(remaining, untilExpiry));
            }
        } catch (InterruptedException x) {
            Thread.currentThread().interrupt();
            throw new WalletBusyException(walletId);
        } finally {
            lock.unlock();
        }
    }

    /** Runs an operation while holding the wallet lock. */
    public <T> T runLocked(String walletId, LockedOperation<T> operation) throws CopayException {
        try (Lease lease = acquire(walletId)) {
            return operation.run();
        }
    }

    public boolean isLocked(String walletId) {
        lock.lock();
        try {
            Lease current = leases.get(walletId);
            return current != null && !current.isExpired();
        } finally {
            lock.unlock();
        }
    }

    private void release(Lease lease) {
        lock.lock();
        try {
            if (leases.get(lease.walletId) == lease) {
                leases.remove(lease.walletId);
                released.signalAll();
            } else {
                log.warn("Lease on wallet {} was released after it expired", lease.walletId);
            }
        } finally {
            lock.unlock();
        }
    }

    public interface LockedOperation<T> {
        T run() throws CopayException;
    }

    /** A granted wallet lock. Closing it more than once has no further effect. */
    public class Lease implements AutoCloseable {
        private final String walletId;
        private final long expiresAt;
        private boolean closed;

        private Lease(String walletId, long expiresAt) {
            this.walletId = walletId;
            this.expiresAt = expiresAt;
        }

        public String getWalletId() {
            return walletId;
        }

        public long getExpiresAt() {
            return expiresAt;
        }

        boolean isExpired() {
            return Utils.currentTimeMillis() >= expiresAt;
        }

        @Override
        public void close() {
            if (closed)
                return;
            closed = true;
            release(this);
        }
    }
}
