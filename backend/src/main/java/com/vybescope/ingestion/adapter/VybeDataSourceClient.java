package com.vybescope.ingestion.adapter;

import com.vybescope.common.RetryPolicy;
import com.vybescope.config.CaffeineConfig;
import com.vybescope.domain.EventDirection;
import com.vybescope.domain.TokenHolder;
import com.vybescope.domain.TokenStats;
import com.vybescope.domain.TransactionEvent;
import com.vybescope.domain.TransferBatch;
import com.vybescope.domain.WalletSnapshot;
import com.vybescope.ingestion.config.IngestionAdapterConfig;
import com.vybescope.ingestion.config.ProviderProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link DataSourceClient} over the Vybe Network REST API.
 * Every request passes the local rate limiter and is retried with {@link RetryPolicy} on transient
 * failures (timeouts, I/O, 429, 5xx). Non-retryable 4xx fail on the first attempt.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VybeDataSourceClient implements DataSourceClient {

    static final String TRANSFERS_PATH = "/token/transfers";

    private static final Comparator<TransactionEvent> CHRONOLOGICAL =
            Comparator.comparing(TransactionEvent::timestamp).thenComparing(TransactionEvent::eventId);

    private final VybeApiClient apiClient;
    private final VybeResponseParser parser;
    private final ProviderProperties properties;
    private final Clock clock;
    @Qualifier(IngestionAdapterConfig.PROVIDER_RETRY_POLICY)
    private final RetryPolicy retryPolicy;
    @Qualifier(IngestionAdapterConfig.PROVIDER_RATE_LIMITER)
    private final RateLimiter rateLimiter;

    @Override
    public TransferBatch getWalletTransactions(String address, Instant since) {
        Instant lowerBound = since != null ? since : defaultLowerBound();
        Instant requestedAt = clock.instant();
        TransferBatch received = fetchTransfers("wallet transfers (in) " + address,
                "receiverAddress", address, EventDirection.IN, lowerBound, requestedAt);
        TransferBatch sent = fetchTransfers("wallet transfers (out) " + address,
                "senderAddress", address, EventDirection.OUT, lowerBound, requestedAt);

        List<TransactionEvent> events = new ArrayList<>(received.events());
        events.addAll(sent.events());
        BigDecimal minValue = properties.getMinValueUsd();
        List<TransactionEvent> kept = normalize(events.stream()
                .filter(e -> minValue == null || e.amount().compareTo(minValue) > 0)
                .toList(), lowerBound);
        // one direction stopping short bounds the whole wallet
        Instant coveredUntil = received.coveredUntil().isBefore(sent.coveredUntil())
                ? received.coveredUntil()
                : sent.coveredUntil();
        return new TransferBatch(kept, coveredUntil, received.truncated() || sent.truncated());
    }

    @Override
    public TransferBatch getTokenLargeTransactions(String tokenMint, BigDecimal minAmount, Instant since) {
        Instant lowerBound = since != null ? since : defaultLowerBound();
        TransferBatch batch = fetchTransfers("token transfers " + tokenMint,
                "mintAddress", tokenMint, EventDirection.TRANSFER, lowerBound, clock.instant());
        BigDecimal floor = minAmount != null ? minAmount : BigDecimal.ZERO;
        List<TransactionEvent> kept = normalize(batch.events().stream()
                .filter(e -> e.amount().compareTo(floor) >= 0)
                .toList(), lowerBound);
        return new TransferBatch(kept, batch.coveredUntil(), batch.truncated());
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.TOKEN_STATS_CACHE, key = "#tokenMint")
    public TokenStats getTokenStats(String tokenMint) {
        String json = call("token stats " + tokenMint, "/token/" + tokenMint, Map.of());
        return parseOrFail(() -> parser.parseTokenStats(json, tokenMint));
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.WALLET_SNAPSHOT_CACHE, key = "#address")
    public WalletSnapshot getWalletSnapshot(String address) {
        String json;
        try {
            json = call("token balances " + address, "/account/token-balance/" + address, Map.of());
        } catch (ProviderUnavailableException e) {
            if (e.isNotFound()) {
                // new or inactive wallets have no balance record
                return WalletSnapshot.empty(address);
            }
            throw e;
        }
        return parseOrFail(() -> parser.parseWalletSnapshot(json, address));
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.TOP_HOLDERS_CACHE, key = "#tokenMint + '-' + #count")
    public List<TokenHolder> getTopTokenHolders(String tokenMint, int count) {
        String json = call("top holders " + tokenMint, "/token/" + tokenMint + "/top-holders", Map.of());
        return parseOrFail(() -> parser.parseTopHolders(json, Math.max(1, count)));
    }

    /**
     * Reads /token/transfers oldest first, page by page, until a short page ends the window or the
     * page budget runs out. A complete read covers the window up to {@code requestedAt} minus the
     * provider's indexing lag. An exhausted budget covers only up to the second before the newest
     * transfer read, so that second is fetched again next time.
     */
    private TransferBatch fetchTransfers(String operation, String filterName, String filterValue,
                                         EventDirection direction, Instant lowerBound, Instant requestedAt) {
        int limit = Math.max(1, properties.getPageLimit());
        int maxPages = Math.max(1, properties.getMaxPages());
        List<TransactionEvent> events = new ArrayList<>();
        for (int page = 0; page < maxPages; page++) {
            String json = call(operation, TRANSFERS_PATH, transferQuery(filterName, filterValue, lowerBound, page, limit));
            VybeResponseParser.TransferPage parsed = parseOrFail(() -> parser.parseTransfers(json, filterValue, direction));
            events.addAll(parsed.events());
            if (parsed.entries() < limit) {
                Instant coveredUntil = requestedAt.minusSeconds(Math.max(0L, properties.getIndexingLagSeconds()));
                return TransferBatch.complete(events, coveredUntil);
            }
        }

        Instant newest = lowerBound;
        for (TransactionEvent e : events) {
            if (e.timestamp().isAfter(newest)) {
                newest = e.timestamp();
            }
        }
        Instant coveredUntil = newest.minusSeconds(1);
        if (!coveredUntil.isAfter(lowerBound)) {
            // the whole budget fell on one second; move on rather than re-read it forever
            coveredUntil = newest;
        }
        log.warn("{}: {} pages of {} read without reaching the end of the window, resuming after {}",
                operation, maxPages, limit, coveredUntil);
        return new TransferBatch(events, coveredUntil, true);
    }

    private Map<String, Object> transferQuery(String filterName, String filterValue, Instant lowerBound,
                                              int page, int limit) {
        Map<String, Object> query = new LinkedHashMap<>();
        query.put(filterName, filterValue);
        query.put("timeStart", lowerBound.getEpochSecond());
        query.put("sortByAsc", "blockTime");
        query.put("page", page);
        query.put("limit", limit);
        return query;
    }

    private Instant defaultLowerBound() {
        return clock.instant().minusSeconds(Math.max(1L, properties.getDefaultLookbackSeconds()));
    }

    /**
     * Drops events at or before the lower bound (the provider's timeStart is inclusive), collapses
     * duplicates by eventId and orders chronologically.
     */
    private static List<TransactionEvent> normalize(List<TransactionEvent> events, Instant lowerBound) {
        Map<String, TransactionEvent> byId = new LinkedHashMap<>();
        for (TransactionEvent e : events) {
            if (e.timestamp().isAfter(lowerBound)) {
                byId.putIfAbsent(e.eventId(), e);
            }
        }
        List<TransactionEvent> out = new ArrayList<>(byId.values());
        out.sort(CHRONOLOGICAL);
        return out;
    }

    private static <T> T parseOrFail(Supplier<T> parse) {
        try {
            return parse.get();
        } catch (VybeApiException e) {
            throw new ProviderUnavailableException(e.getMessage(), e.getStatusCode(), e);
        }
    }

    private String call(String operation, String path, Map<String, ?> query) {
        Exception lastException = null;
        int lastStatus = 0;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepQuietly(retryPolicy.delayMs(attempt - 1));
            }
            try {
                if (!rateLimiter.acquirePermission()) {
                    throw new VybeApiException(0, "Local limiter timeout before " + operation);
                }
                String json = apiClient.get(path, query).block();
                if (json == null || json.isBlank()) {
                    throw new VybeApiException(0, "Empty Vybe response");
                }
                return json;
            } catch (VybeApiException e) {
                lastException = e;
                lastStatus = e.getStatusCode();
                if (!e.isRetryable()) {
                    throw new ProviderUnavailableException(
                            operation + " rejected with HTTP " + e.getStatusCode(), e.getStatusCode(), e);
                }
            } catch (RuntimeException e) {
                lastException = e;
                lastStatus = 0;
            }
            log.debug("{} attempt {}/{} failed: {}", operation, attempt + 1, retryPolicy.getMaxAttempts(),
                    messageOf(lastException));
        }
        throw new ProviderUnavailableException(
                operation + " failed after " + retryPolicy.getMaxAttempts() + " attempts: " + messageOf(lastException),
                lastStatus,
                lastException);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("Interrupted during provider retry", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
