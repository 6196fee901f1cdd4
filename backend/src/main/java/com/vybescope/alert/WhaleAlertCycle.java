package com.vybescope.alert;

import com.vybescope.alert.config.PollSchedule;
import com.vybescope.domain.NotificationIntent;
import com.vybescope.domain.NotificationKind;
import com.vybescope.domain.TransactionEvent;
import com.vybescope.domain.TransferBatch;
import com.vybescope.domain.WhaleAlertConfig;
import com.vybescope.ingestion.adapter.DataSourceClient;
import com.vybescope.notification.NotificationSink;
import com.vybescope.subscription.RegistrySnapshot;
import com.vybescope.subscription.SubscriptionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Whale-alert tick: polls each watched mint once with the lowest threshold among its watchers and
 * sends WHALE_ALERT intents to every watcher whose own threshold the transfer meets.
 */
@Component
@Slf4j
public class WhaleAlertCycle extends PollCycle {

    private final SubscriptionRegistry registry;
    private final DataSourceClient dataSourceClient;
    private final SeenEventStore seenEventStore;
    private final EntityFetcher entityFetcher;
    private final Duration initialLookback;
    private final WatermarkTracker watermarks = new WatermarkTracker();

    public WhaleAlertCycle(
            SubscriptionRegistry registry,
            DataSourceClient dataSourceClient,
            SeenEventStore seenEventStore,
            EntityFetcher entityFetcher,
            NotificationSink notificationSink,
            PollSchedule pollSchedule,
            Clock clock) {
        super(CycleType.WHALE_ALERT, notificationSink, clock);
        this.registry = registry;
        this.dataSourceClient = dataSourceClient;
        this.seenEventStore = seenEventStore;
        this.entityFetcher = entityFetcher;
        this.initialLookback = pollSchedule.whaleAlert().initialLookback();
    }

    @Override
    protected TickReport runTick() {
        Instant startedAt = clock.instant();
        RegistrySnapshot snapshot = registry.snapshot();
        Map<String, List<WhaleAlertConfig>> watchersByMint = new LinkedHashMap<>();
        for (WhaleAlertConfig config : snapshot.activeWhaleConfigs()) {
            for (String mint : config.tokenMints()) {
                watchersByMint.computeIfAbsent(mint, k -> new ArrayList<>()).add(config);
            }
        }
        if (watchersByMint.isEmpty()) {
            watermarks.retainOnly(Set.of());
            return TickReport.noWork(CycleType.WHALE_ALERT, startedAt);
        }

        Instant fallback = startedAt.minus(initialLookback);
        Map<String, Instant> since = new LinkedHashMap<>();
        Map<String, BigDecimal> minThreshold = new LinkedHashMap<>();
        watchersByMint.forEach((mint, watchers) -> {
            since.put(mint, watermarks.sinceFor(mint, fallback));
            minThreshold.put(mint, watchers.stream()
                    .map(WhaleAlertConfig::thresholdAmount)
                    .min(BigDecimal::compareTo)
                    .orElse(WhaleAlertConfig.DEFAULT_THRESHOLD));
        });

        EntityFetcher.Result<String, TransferBatch> fetched = entityFetcher.fetchAll(
                CycleType.WHALE_ALERT,
                since.keySet(),
                mint -> dataSourceClient.getTokenLargeTransactions(mint, minThreshold.get(mint), since.get(mint)));

        List<TransactionEvent> candidates = new ArrayList<>();
        fetched.succeeded().values().forEach(batch -> candidates.addAll(batch.events()));
        candidates.sort(WalletTrackingCycle.CHRONOLOGICAL);

        Set<String> unfinished = new HashSet<>();
        int newEvents = 0;
        int intents = 0;
        boolean interrupted = false;
        for (int i = 0; i < candidates.size(); i++) {
            if (isStopping()) {
                interrupted = true;
                for (int j = i; j < candidates.size(); j++) {
                    unfinished.add(candidates.get(j).subject());
                }
                break;
            }
            TransactionEvent event = candidates.get(i);
            if (!seenEventStore.markAndCheck(event.eventId())) {
                continue;
            }
            newEvents++;
            Instant now = clock.instant();
            for (WhaleAlertConfig watcher : watchersByMint.getOrDefault(event.subject(), List.of())) {
                if (watcher.isMetBy(event.amount())
                        && dispatch(new NotificationIntent(watcher.userId(), NotificationKind.WHALE_ALERT, event, now))) {
                    intents++;
                }
            }
        }

        fetched.succeeded().forEach((mint, batch) -> {
            if (!unfinished.contains(mint)) {
                watermarks.advance(mint, batch.nextWatermark(since.get(mint)));
            }
        });
        watermarks.retainOnly(watchersByMint.keySet());

        return new TickReport(
                CycleType.WHALE_ALERT,
                startedAt,
                Duration.between(startedAt, clock.instant()),
                watchersByMint.size(),
                fetched.failed().size(),
                candidates.size(),
                newEvents,
                intents,
                interrupted);
    }

    WatermarkTracker watermarks() {
        return watermarks;
    }
}
