package com.vybescope.api.controller;

import com.vybescope.api.dto.AddWalletRequest;
import com.vybescope.api.dto.WalletResponse;
import com.vybescope.subscription.UserSettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Tracked wallets of a user and "Clear Dashboard". Settings writes hit MongoDB, so they run on
 * the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/v1/users/{userId}")
@RequiredArgsConstructor
public class UserDashboardController {

    private final UserSettingsService userSettingsService;

    /**
     * 201 when the wallet is newly tracked, 200 when it already was.
     */
    @PostMapping("/wallets")
    public Mono<ResponseEntity<WalletResponse>> addWallet(@PathVariable long userId,
                                                          @RequestBody @Valid AddWalletRequest request) {
        String address = request.address().trim();
        return Mono.fromCallable(() -> {
                    boolean created = userSettingsService.addWallet(userId, address);
                    WalletResponse body = userSettingsService.listWallets(userId).stream()
                            .filter(s -> s.walletAddress().equals(address))
                            .findFirst()
                            .map(WalletResponse::from)
                            .orElse(new WalletResponse(address, null));
                    return ResponseEntity.status(created ? HttpStatus.CREATED : HttpStatus.OK).body(body);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/wallets")
    public List<WalletResponse> listWallets(@PathVariable long userId) {
        return userSettingsService.listWallets(userId).stream()
                .map(WalletResponse::from)
                .toList();
    }

    @DeleteMapping("/wallets/{address}")
    public Mono<ResponseEntity<Void>> removeWallet(@PathVariable long userId, @PathVariable String address) {
        return Mono.fromCallable(() -> {
                    userSettingsService.removeWallet(userId, address);
                    return ResponseEntity.noContent().<Void>build();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping
    public Mono<ResponseEntity<Void>> clearDashboard(@PathVariable long userId) {
        return Mono.fromCallable(() -> {
                    userSettingsService.clearDashboard(userId);
                    return ResponseEntity.noContent().<Void>build();
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
