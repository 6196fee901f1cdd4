package com.vybescope.alert;

import com.vybescope.alert.config.AlertProperties;
import com.vybescope.alert.config.PollSchedule;
import com.vybescope.domain.NotificationIntent;
import com.vybescope.domain.NotificationKind;
import com.vybescope.domain.TransactionEvent;
import com.vybescope.domain.TransferBatch;
import com.vybescope.ingestion.adapter.DataSourceClient;
import com.vybescope.ingestion.adapter.ProviderUnavailableException;
import com.vybescope.notification.NotificationSink;
import com.vybescope.subscription.AddressValidator;
import com.vybescope.subscription.SubscriptionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.vybescope.alert.TestEvents.batch;
import static com.vybescope.alert.TestEvents.walletIn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WalletTrackingCycleTest {

    private static final String WALLET_W = "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM";
    private static final String WALLET_V = "5Q544fKrFoe6tsEbD7S8EmxGTJYAKtTVhAW5Q5pge4j1";
    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");

    @Mock
    private DataSourceClient dataSourceClient;

    private final List<NotificationIntent> published = new ArrayList<>();
    private SubscriptionRegistry registry;
    private SeenEventStore seenEventStore;
    private WalletTrackingCycle cycle;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        registry = new SubscriptionRegistry(new AddressValidator(), clock);
        seenEventStore = new SeenEventStore(clock);
        NotificationSink sink = published::add;
        cycle = new WalletTrackingCycle(
                registry,
                dataSourceClient,
                seenEventStore,
                new EntityFetcher(Runnable::run),
                sink,
                PollSchedule.from(new AlertProperties()),
                clock);
    }

    @Test
    @DisplayName("e1 then e1+e2: one intent per tick, only for the new event")
    void tick_repeatedEvent_notifiedOnce() {
        registry.addWallet(1L, WALLET_W);
        TransactionEvent e1 = walletIn("sig1", WALLET_W, NOW.minusSeconds(60), "10");
        TransactionEvent e2 = walletIn("sig2", WALLET_W, NOW.minusSeconds(30), "20");
        when(dataSourceClient.getWalletTransactions(eq(WALLET_W), any()))
                .thenReturn(batch(e1))
                .thenReturn(batch(e1, e2));

        cycle.tick();
        assertThat(published).extracting(i -> i.payload().eventId()).containsExactly(e1.eventId());

        cycle.tick();
        assertThat(published).extracting(i -> i.payload().eventId()).containsExactly(e1.eventId(), e2.eventId());
        assertThat(published).allSatisfy(i -> {
            assertThat(i.userId()).isEqualTo(1L);
            assertThat(i.kind()).isEqualTo(NotificationKind.WALLET_TRANSFER);
        });
    }

    @Test
    void tick_firstFetch_usesIntervalLookbackThenWatermark() {
        registry.addWallet(1L, WALLET_W);
        Instant eventTime = NOW.minusSeconds(10);
        when(dataSourceClient.getWalletTransactions(eq(WALLET_W), any()))
                .thenReturn(batch(walletIn("sig1", WALLET_W, eventTime, "10")));

        cycle.tick();
        verify(dataSourceClient).getWalletTransactions(WALLET_W, NOW.minusSeconds(120));
        assertThat(cycle.watermarks().get(WALLET_W)).contains(eventTime);

        cycle.tick();
        verify(dataSourceClient).getWalletTransactions(WALLET_W, eventTime);
    }

    @Test
    @DisplayName("a wallet shared by two users produces one intent per subscriber")
    void tick_sharedWallet_fansOutToEverySubscriber() {
        registry.addWallet(2L, WALLET_W);
        registry.addWallet(1L, WALLET_W);
        when(dataSourceClient.getWalletTransactions(eq(WALLET_W), any()))
                .thenReturn(batch(walletIn("sig1", WALLET_W, NOW.minusSeconds(5), "10")));

        cycle.tick();

        assertThat(published).extracting(NotificationIntent::userId).containsExactly(1L, 2L);
        verify(dataSourceClient).getWalletTransactions(eq(WALLET_W), any());
    }

    @Test
    @DisplayName("provider failure on one wallet does not block the others")
    void tick_oneWalletFails_otherWalletStillNotified() {
        registry.addWallet(1L, WALLET_W);
        registry.addWallet(1L, WALLET_V);
        when(dataSourceClient.getWalletTransactions(eq(WALLET_W), any()))
                .thenThrow(new ProviderUnavailableException("timeout", 0, null));
        when(dataSourceClient.getWalletTransactions(eq(WALLET_V), any()))
                .thenReturn(batch(walletIn("sigV", WALLET_V, NOW.minusSeconds(5), "10")));

        cycle.tick();

        assertThat(published).extracting(i -> i.payload().subject()).containsExactly(WALLET_V);
        assertThat(cycle.watermarks().get(WALLET_W)).isEmpty();
        assertThat(cycle.lastReport().failedEntities()).isEqualTo(1);
    }

    @Test
    void tick_mergesWalletsInTimestampOrder() {
        registry.addWallet(1L, WALLET_W);
        registry.addWallet(1L, WALLET_V);
        TransactionEvent late = walletIn("late", WALLET_W, NOW.minusSeconds(10), "1");
        TransactionEvent early = walletIn("early", WALLET_V, NOW.minusSeconds(50), "1");
        when(dataSourceClient.getWalletTransactions(eq(WALLET_W), any())).thenReturn(batch(late));
        when(dataSourceClient.getWalletTransactions(eq(WALLET_V), any())).thenReturn(batch(early));

        cycle.tick();

        assertThat(published).extracting(i -> i.payload().signature()).containsExactly("early", "late");
    }

    @Test
    void tick_olderEventsLater_neverMoveWatermarkBack() {
        registry.addWallet(1L, WALLET_W);
        Instant newer = NOW.minusSeconds(10);
        when(dataSourceClient.getWalletTransactions(eq(WALLET_W), any()))
                .thenReturn(batch(walletIn("a", WALLET_W, newer, "1")))
                .thenReturn(batch(walletIn("b", WALLET_W, NOW.minusSeconds(100), "1")));

        cycle.tick();
        cycle.tick();

        assertThat(cycle.watermarks().get(WALLET_W)).contains(newer);
    }

    @Test
    @DisplayName("a quiet wallet moves up to the covered instant so its window stays one interval wide")
    void tick_noActivity_advancesWatermarkToCoveredInstant() {
        registry.addWallet(1L, WALLET_W);
        when(dataSourceClient.getWalletTransactions(eq(WALLET_W), any()))
                .thenReturn(TransferBatch.complete(List.of(), NOW.minusSeconds(30)));

        cycle.tick();
        cycle.tick();

        assertThat(published).isEmpty();
        assertThat(cycle.watermarks().get(WALLET_W)).contains(NOW.minusSeconds(30));
        verify(dataSourceClient).getWalletTransactions(WALLET_W, NOW.minusSeconds(120));
        verify(dataSourceClient).getWalletTransactions(WALLET_W, NOW.minusSeconds(30));
    }

    @Test
    void tick_truncatedBatch_doesNotSkipPastCoveredInstant() {
        registry.addWallet(1L, WALLET_W);
        Instant coveredUntil = NOW.minusSeconds(61);
        when(dataSourceClient.getWalletTransactions(eq(WALLET_W), any())).thenReturn(new TransferBatch(List.of(
                walletIn("a", WALLET_W, NOW.minusSeconds(70), "1"),
                walletIn("b", WALLET_W, NOW.minusSeconds(60), "1"),
                walletIn("c", WALLET_W, NOW.minusSeconds(10), "1")), coveredUntil, true));

        cycle.tick();

        assertThat(published).hasSize(3);
        assertThat(cycle.watermarks().get(WALLET_W)).contains(coveredUntil);
    }

    @Test
    void tick_noWallets_doesNoWork() {
        cycle.tick();

        verify(dataSourceClient, never()).getWalletTransactions(any(), any());
        assertThat(cycle.lastReport().entities()).isZero();
    }

    @Test
    void tick_untrackedWallet_dropsItsWatermark() {
        registry.addWallet(1L, WALLET_W);
        when(dataSourceClient.getWalletTransactions(eq(WALLET_W), any())).thenReturn(batch());
        cycle.tick();
        assertThat(cycle.watermarks().size()).isEqualTo(1);

        registry.removeWallet(1L, WALLET_W);
        cycle.tick();

        assertThat(cycle.watermarks().size()).isZero();
    }

    @Test
    @DisplayName("stop requested mid-tick: nothing is marked and the watermark stays put")
    void runTick_stopRequested_leavesEventsUnmarked() {
        registry.addWallet(1L, WALLET_W);
        TransactionEvent e1 = walletIn("sig1", WALLET_W, NOW.minusSeconds(5), "1");
        when(dataSourceClient.getWalletTransactions(eq(WALLET_W), any())).thenReturn(batch(e1));
        cycle.requestStop();

        TickReport report = cycle.runTick();

        assertThat(report.interrupted()).isTrue();
        assertThat(published).isEmpty();
        assertThat(seenEventStore.contains(e1.eventId())).isFalse();
        assertThat(cycle.watermarks().get(WALLET_W)).isEmpty();
    }

    @Test
    void tick_sinkFailure_eventStillMarkedSeen() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        NotificationSink failing = intent -> {
            throw new IllegalStateException("sink down");
        };
        WalletTrackingCycle failingCycle = new WalletTrackingCycle(
                registry, dataSourceClient, seenEventStore, new EntityFetcher(Runnable::run), failing,
                PollSchedule.from(new AlertProperties()), clock);
        registry.addWallet(1L, WALLET_W);
        TransactionEvent e1 = walletIn("sig1", WALLET_W, NOW.minusSeconds(5), "1");
        when(dataSourceClient.getWalletTransactions(eq(WALLET_W), any())).thenReturn(batch(e1));

        failingCycle.tick();

        assertThat(seenEventStore.contains(e1.eventId())).isTrue();
        assertThat(failingCycle.lastReport().newEvents()).isEqualTo(1);
        assertThat(failingCycle.lastReport().intents()).isZero();
    }
}
