package com.vybescope.subscription;

import com.vybescope.domain.UserDashboard;
import com.vybescope.domain.UserDashboardRepository;
import com.vybescope.domain.WalletSubscription;
import com.vybescope.domain.WhaleAlertConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Inbound settings operations: validates, mutates the registry, then writes the user's full dashboard
 * through to MongoDB. The registry is updated first so the next tick sees the change even if the
 * write fails; the failure is still reported to the caller.
 * <p>
 * Mutation, dashboard read and save run under one per-user lock, so the last document written for a
 * user always reflects the last mutation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UserSettingsService {

    private final SubscriptionRegistry registry;
    private final UserDashboardRepository userDashboardRepository;
    private final Clock clock;
    private final ConcurrentMap<Long, ReentrantLock> userLocks = new ConcurrentHashMap<>();

    /**
     * @return true if the wallet was newly added
     */
    public boolean addWallet(long userId, String address) {
        return withUserLock(userId, () -> {
            boolean created = registry.addWallet(userId, address);
            if (created) {
                persist(userId);
                log.info("User {} now tracks wallet {}", userId, address.trim());
            }
            return created;
        });
    }

    public boolean removeWallet(long userId, String address) {
        return withUserLock(userId, () -> {
            boolean removed = registry.removeWallet(userId, address);
            if (removed) {
                persist(userId);
                log.info("User {} stopped tracking wallet {}", userId, address.trim());
            }
            return removed;
        });
    }

    public List<WalletSubscription> listWallets(long userId) {
        return registry.listWallets(userId);
    }

    public WhaleAlertConfig updateWhaleAlert(long userId, Collection<String> tokens, BigDecimal threshold, boolean enabled) {
        WhaleAlertConfig config = withUserLock(userId, () -> {
            WhaleAlertConfig updated = registry.setWhaleConfig(userId, tokens, threshold, enabled);
            persist(userId);
            return updated;
        });
        log.info("User {} whale alert: enabled={} tokens={} threshold={}",
                userId, config.enabled(), config.tokenMints().size(), config.thresholdAmount().toPlainString());
        return config;
    }

    public WhaleAlertConfig getWhaleAlert(long userId) {
        return registry.getWhaleConfig(userId);
    }

    /**
     * Clears the dashboard: all tracked wallets and whale settings of the user.
     */
    public void clearDashboard(long userId) {
        withUserLock(userId, () -> {
            registry.clearUser(userId);
            try {
                userDashboardRepository.deleteById(userId);
            } catch (DataAccessException e) {
                log.error("Failed to delete dashboard of user {}", userId, e);
                throw e;
            }
            return null;
        });
        log.info("User {} cleared dashboard", userId);
    }

    private <T> T withUserLock(long userId, Supplier<T> action) {
        ReentrantLock lock = userLocks.computeIfAbsent(userId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void persist(long userId) {
        UserDashboard dashboard = new UserDashboard();
        dashboard.setUserId(userId);
        List<UserDashboard.TrackedWallet> wallets = new ArrayList<>();
        for (WalletSubscription s : registry.listWallets(userId)) {
            wallets.add(new UserDashboard.TrackedWallet(s.walletAddress(), s.createdAt()));
        }
        dashboard.setWallets(wallets);
        WhaleAlertConfig whale = registry.getWhaleConfig(userId);
        UserDashboard.WhaleAlertSettings settings = new UserDashboard.WhaleAlertSettings();
        settings.setTokens(new ArrayList<>(whale.tokenMints()));
        settings.setThreshold(whale.thresholdAmount());
        settings.setEnabled(whale.enabled());
        dashboard.setWhaleAlert(settings);
        dashboard.setUpdatedAt(clock.instant());
        try {
            userDashboardRepository.save(dashboard);
        } catch (DataAccessException e) {
            log.error("Failed to persist dashboard of user {}", userId, e);
            throw e;
        }
    }
}
