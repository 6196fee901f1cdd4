package com.vybescope.subscription;

import com.vybescope.domain.WalletSubscription;
import com.vybescope.domain.WhaleAlertConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable point-in-time copy of the registry. A tick works from one snapshot from start to end.
 *
 * @param wallets      userId to that user's subscriptions in insertion order
 * @param whaleConfigs userId to whale-alert config
 * @param version      registry mutation counter at the time of the copy
 */
public record RegistrySnapshot(
        Map<Long, List<WalletSubscription>> wallets,
        Map<Long, WhaleAlertConfig> whaleConfigs,
        long version
) {

    public RegistrySnapshot {
        wallets = Map.copyOf(wallets);
        whaleConfigs = Map.copyOf(whaleConfigs);
    }

    /**
     * Distinct tracked addresses with their subscribers. Subscribers are sorted by userId so fan-out
     * order is stable between ticks.
     */
    public Map<String, List<Long>> subscribersByWallet() {
        Map<String, List<Long>> out = new LinkedHashMap<>();
        wallets.keySet().stream().sorted().forEach(userId -> {
            for (WalletSubscription s : wallets.get(userId)) {
                out.computeIfAbsent(s.walletAddress(), k -> new ArrayList<>()).add(userId);
            }
        });
        return out;
    }

    /**
     * Enabled configs with at least one token, ordered by userId.
     */
    public List<WhaleAlertConfig> activeWhaleConfigs() {
        return whaleConfigs.values().stream()
                .filter(WhaleAlertConfig::isActive)
                .sorted((a, b) -> Long.compare(a.userId(), b.userId()))
                .toList();
    }

    public boolean isEmpty() {
        return wallets.isEmpty() && activeWhaleConfigs().isEmpty();
    }
}
