package com.vybescope.api.controller;

import com.vybescope.domain.TokenHolder;
import com.vybescope.domain.TokenStats;
import com.vybescope.ingestion.adapter.DataSourceClient;
import com.vybescope.subscription.AddressValidator;
import com.vybescope.subscription.InvalidAddressException;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * GET /tokens/{mint}/stats and /tokens/{mint}/top-holders.
 */
@RestController
@RequestMapping("/api/v1/tokens/{mint}")
@RequiredArgsConstructor
public class TokenController {

    static final int MAX_HOLDERS = 50;

    private final DataSourceClient dataSourceClient;
    private final AddressValidator addressValidator;

    @GetMapping("/stats")
    public Mono<TokenStats> stats(@PathVariable String mint) {
        String tokenMint = requireValid(mint);
        return Mono.fromCallable(() -> dataSourceClient.getTokenStats(tokenMint))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/top-holders")
    public Mono<List<TokenHolder>> topHolders(@PathVariable String mint,
                                              @RequestParam(defaultValue = "5") int count) {
        String tokenMint = requireValid(mint);
        if (count < 1 || count > MAX_HOLDERS) {
            throw new IllegalArgumentException("count must be between 1 and " + MAX_HOLDERS);
        }
        return Mono.fromCallable(() -> dataSourceClient.getTopTokenHolders(tokenMint, count))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String requireValid(String mint) {
        if (!addressValidator.isValidAddress(mint)) {
            throw new InvalidAddressException(mint);
        }
        return mint.trim();
    }
}
