package com.vybescope.subscription;

import com.vybescope.domain.UserDashboard;
import com.vybescope.domain.WalletSubscription;
import com.vybescope.domain.WhaleAlertConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory index of tracked wallets and whale-alert configs per user.
 * Read-heavy: ticks take a {@link #snapshot()} under the read lock, chat commands mutate under the
 * write lock. No I/O happens while a lock is held.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SubscriptionRegistry {

    private final AddressValidator addressValidator;
    private final Clock clock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    /** userId to (address to subscription), insertion ordered. */
    private final Map<Long, LinkedHashMap<String, WalletSubscription>> wallets = new HashMap<>();
    private final Map<Long, WhaleAlertConfig> whaleConfigs = new HashMap<>();
    private long version;

    /**
     * @return true if a new subscription was created, false if the user already tracked the address
     * @throws InvalidAddressException when the address is not a Solana Base58 address
     */
    public boolean addWallet(long userId, String address) {
        String normalized = requireValidAddress(address);
        lock.writeLock().lock();
        try {
            LinkedHashMap<String, WalletSubscription> userWallets =
                    wallets.computeIfAbsent(userId, k -> new LinkedHashMap<>());
            if (userWallets.containsKey(normalized)) {
                return false;
            }
            userWallets.put(normalized, new WalletSubscription(userId, normalized, clock.instant()));
            version++;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean removeWallet(long userId, String address) {
        if (address == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            LinkedHashMap<String, WalletSubscription> userWallets = wallets.get(userId);
            if (userWallets == null || userWallets.remove(address.trim()) == null) {
                return false;
            }
            if (userWallets.isEmpty()) {
                wallets.remove(userId);
            }
            version++;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<WalletSubscription> listWallets(long userId) {
        lock.readLock().lock();
        try {
            LinkedHashMap<String, WalletSubscription> userWallets = wallets.get(userId);
            return userWallets == null ? List.of() : List.copyOf(userWallets.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the user's whale-alert config as a whole.
     *
     * @param threshold USD threshold, null for {@link WhaleAlertConfig#DEFAULT_THRESHOLD}
     */
    public WhaleAlertConfig setWhaleConfig(long userId, Collection<String> tokens, BigDecimal threshold, boolean enabled) {
        BigDecimal effective = threshold != null ? threshold : WhaleAlertConfig.DEFAULT_THRESHOLD;
        if (effective.signum() < 0) {
            throw new InvalidWhaleConfigException("Threshold must not be negative: " + effective.toPlainString());
        }
        Set<String> mints = new LinkedHashSet<>();
        if (tokens != null) {
            for (String token : tokens) {
                mints.add(requireValidAddress(token));
            }
        }
        WhaleAlertConfig config = new WhaleAlertConfig(
                userId, Collections.unmodifiableSet(mints), effective, enabled);
        lock.writeLock().lock();
        try {
            whaleConfigs.put(userId, config);
            version++;
        } finally {
            lock.writeLock().unlock();
        }
        return config;
    }

    public WhaleAlertConfig getWhaleConfig(long userId) {
        lock.readLock().lock();
        try {
            return whaleConfigs.getOrDefault(userId, WhaleAlertConfig.disabled(userId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops every wallet and the whale config of the user.
     */
    public void clearUser(long userId) {
        lock.writeLock().lock();
        try {
            boolean changed = wallets.remove(userId) != null;
            changed |= whaleConfigs.remove(userId) != null;
            if (changed) {
                version++;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Loads a persisted dashboard, replacing whatever the registry holds for that user.
     * Invalid entries are skipped with a warning so one bad document cannot block startup.
     */
    public void restore(UserDashboard dashboard) {
        if (dashboard == null || dashboard.getUserId() == null) {
            return;
        }
        long userId = dashboard.getUserId();
        LinkedHashMap<String, WalletSubscription> restored = new LinkedHashMap<>();
        if (dashboard.getWallets() != null) {
            for (UserDashboard.TrackedWallet w : dashboard.getWallets()) {
                if (w == null || !addressValidator.isValidAddress(w.getAddress())) {
                    log.warn("Skipping invalid persisted wallet for user {}", userId);
                    continue;
                }
                String address = w.getAddress().trim();
                Instant createdAt = w.getCreatedAt() != null ? w.getCreatedAt() : clock.instant();
                restored.putIfAbsent(address, new WalletSubscription(userId, address, createdAt));
            }
        }
        WhaleAlertConfig whale = restoreWhale(userId, dashboard.getWhaleAlert());

        lock.writeLock().lock();
        try {
            if (restored.isEmpty()) {
                wallets.remove(userId);
            } else {
                wallets.put(userId, restored);
            }
            if (whale == null) {
                whaleConfigs.remove(userId);
            } else {
                whaleConfigs.put(userId, whale);
            }
            version++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private WhaleAlertConfig restoreWhale(long userId, UserDashboard.WhaleAlertSettings settings) {
        if (settings == null) {
            return null;
        }
        Set<String> mints = new LinkedHashSet<>();
        if (settings.getTokens() != null) {
            for (String token : settings.getTokens()) {
                if (addressValidator.isValidAddress(token)) {
                    mints.add(token.trim());
                } else {
                    log.warn("Skipping invalid persisted whale token for user {}", userId);
                }
            }
        }
        BigDecimal threshold = settings.getThreshold();
        if (threshold == null || threshold.signum() < 0) {
            threshold = WhaleAlertConfig.DEFAULT_THRESHOLD;
        }
        return new WhaleAlertConfig(userId, Collections.unmodifiableSet(mints), threshold, settings.isEnabled());
    }

    public RegistrySnapshot snapshot() {
        lock.readLock().lock();
        try {
            Map<Long, List<WalletSubscription>> walletCopy = new HashMap<>();
            wallets.forEach((userId, subs) -> {
                if (subs.isEmpty()) {
                    throw new RegistryInvariantViolationException("Empty wallet map retained for user " + userId);
                }
                walletCopy.put(userId, List.copyOf(subs.values()));
            });
            return new RegistrySnapshot(walletCopy, new HashMap<>(whaleConfigs), version);
        } finally {
            lock.readLock().unlock();
        }
    }

    private String requireValidAddress(String address) {
        if (!addressValidator.isValidAddress(address)) {
            throw new InvalidAddressException(address);
        }
        return address.trim();
    }
}
