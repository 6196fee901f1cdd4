package com.vybescope.alert;

import com.vybescope.config.AsyncConfig;
import com.vybescope.ingestion.adapter.ProviderUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Runs one provider fetch per entity on the bounded fetch executor and waits for all of them.
 * A failing entity is reported in {@link Result#failed()} and never affects the others.
 */
@Component
@Slf4j
public class EntityFetcher {

    private final Executor fetchExecutor;

    public EntityFetcher(@Qualifier(AsyncConfig.FETCH_EXECUTOR) Executor fetchExecutor) {
        this.fetchExecutor = fetchExecutor;
    }

    public record Result<K, V>(Map<K, V> succeeded, Set<K> failed) {
    }

    public <K, V> Result<K, V> fetchAll(CycleType cycle, Collection<K> keys, Function<K, V> fetch) {
        List<K> ordered = new ArrayList<>(keys);
        List<CompletableFuture<V>> futures = new ArrayList<>(ordered.size());
        for (K key : ordered) {
            futures.add(CompletableFuture.supplyAsync(() -> fetch.apply(key), fetchExecutor));
        }
        Map<K, V> succeeded = new LinkedHashMap<>();
        Set<K> failed = new LinkedHashSet<>();
        for (int i = 0; i < ordered.size(); i++) {
            K key = ordered.get(i);
            try {
                succeeded.put(key, futures.get(i).join());
            } catch (CompletionException e) {
                failed.add(key);
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof ProviderUnavailableException) {
                    log.warn("{}: skipping {} this tick: {}", cycle, key, cause.getMessage());
                } else {
                    log.error("{}: unexpected failure fetching {}", cycle, key, cause);
                }
            }
        }
        return new Result<>(succeeded, failed);
    }
}
