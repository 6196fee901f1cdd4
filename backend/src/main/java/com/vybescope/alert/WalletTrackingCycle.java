package com.vybescope.alert;

import com.vybescope.alert.config.PollSchedule;
import com.vybescope.domain.NotificationIntent;
import com.vybescope.domain.NotificationKind;
import com.vybescope.domain.TransactionEvent;
import com.vybescope.domain.TransferBatch;
import com.vybescope.ingestion.adapter.DataSourceClient;
import com.vybescope.notification.NotificationSink;
import com.vybescope.subscription.RegistrySnapshot;
import com.vybescope.subscription.SubscriptionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Wallet-tracking tick: polls every distinct tracked wallet once, dedups the merged result and
 * emits one WALLET_TRANSFER intent per (new event, subscriber).
 */
@Component
@Slf4j
public class WalletTrackingCycle extends PollCycle {

    static final Comparator<TransactionEvent> CHRONOLOGICAL =
            Comparator.comparing(TransactionEvent::timestamp).thenComparing(TransactionEvent::eventId);

    private final SubscriptionRegistry registry;
    private final DataSourceClient dataSourceClient;
    private final SeenEventStore seenEventStore;
    private final EntityFetcher entityFetcher;
    private final Duration initialLookback;
    private final WatermarkTracker watermarks = new WatermarkTracker();

    public WalletTrackingCycle(
            SubscriptionRegistry registry,
            DataSourceClient dataSourceClient,
            SeenEventStore seenEventStore,
            EntityFetcher entityFetcher,
            NotificationSink notificationSink,
            PollSchedule pollSchedule,
            Clock clock) {
        super(CycleType.WALLET_TRACKING, notificationSink, clock);
        this.registry = registry;
        this.dataSourceClient = dataSourceClient;
        this.seenEventStore = seenEventStore;
        this.entityFetcher = entityFetcher;
        this.initialLookback = pollSchedule.walletTracking().initialLookback();
    }

    @Override
    protected TickReport runTick() {
        Instant startedAt = clock.instant();
        RegistrySnapshot snapshot = registry.snapshot();
        Map<String, List<Long>> subscribers = snapshot.subscribersByWallet();
        if (subscribers.isEmpty()) {
            watermarks.retainOnly(Set.of());
            return TickReport.noWork(CycleType.WALLET_TRACKING, startedAt);
        }

        Instant fallback = startedAt.minus(initialLookback);
        Map<String, Instant> since = new LinkedHashMap<>();
        subscribers.keySet().forEach(address -> since.put(address, watermarks.sinceFor(address, fallback)));

        EntityFetcher.Result<String, TransferBatch> fetched = entityFetcher.fetchAll(
                CycleType.WALLET_TRACKING,
                since.keySet(),
                address -> dataSourceClient.getWalletTransactions(address, since.get(address)));

        List<TransactionEvent> candidates = new ArrayList<>();
        fetched.succeeded().values().forEach(batch -> candidates.addAll(batch.events()));
        candidates.sort(CHRONOLOGICAL);

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
            for (Long userId : subscribers.getOrDefault(event.subject(), List.of())) {
                if (dispatch(new NotificationIntent(userId, NotificationKind.WALLET_TRANSFER, event, now))) {
                    intents++;
                }
            }
            log.debug("New wallet event {} for {} subscriber(s)", event.eventId(),
                    subscribers.getOrDefault(event.subject(), List.of()).size());
        }

        fetched.succeeded().forEach((address, batch) -> {
            if (!unfinished.contains(address)) {
                watermarks.advance(address, batch.nextWatermark(since.get(address)));
            }
        });
        watermarks.retainOnly(subscribers.keySet());

        return new TickReport(
                CycleType.WALLET_TRACKING,
                startedAt,
                Duration.between(startedAt, clock.instant()),
                subscribers.size(),
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
