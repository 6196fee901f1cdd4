package com.vybescope.api.controller;

import com.vybescope.domain.TransactionEvent;
import com.vybescope.domain.WalletSnapshot;
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

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Provider passthrough reads for a wallet: balances snapshot and recent transfers.
 */
@RestController
@RequestMapping("/api/v1/wallets/{address}")
@RequiredArgsConstructor
public class WalletController {

    static final int MAX_HOURS = 168;

    private final DataSourceClient dataSourceClient;
    private final AddressValidator addressValidator;
    private final Clock clock;

    @GetMapping("/snapshot")
    public Mono<WalletSnapshot> snapshot(@PathVariable String address) {
        String owner = requireValid(address);
        return Mono.fromCallable(() -> dataSourceClient.getWalletSnapshot(owner))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Transfers of the last {@code hours} hours (1 to 168), oldest first.
     */
    @GetMapping("/transactions")
    public Mono<List<TransactionEvent>> recentTransactions(@PathVariable String address,
                                                           @RequestParam(defaultValue = "24") int hours) {
        String owner = requireValid(address);
        if (hours < 1 || hours > MAX_HOURS) {
            throw new IllegalArgumentException("hours must be between 1 and " + MAX_HOURS);
        }
        return Mono.fromCallable(() -> dataSourceClient.getWalletTransactions(
                        owner, clock.instant().minus(Duration.ofHours(hours))).events())
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String requireValid(String address) {
        if (!addressValidator.isValidAddress(address)) {
            throw new InvalidAddressException(address);
        }
        return address.trim();
    }
}
