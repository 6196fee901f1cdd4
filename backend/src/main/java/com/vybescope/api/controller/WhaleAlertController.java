package com.vybescope.api.controller;

import com.vybescope.api.dto.WhaleAlertConfigRequest;
import com.vybescope.api.dto.WhaleAlertConfigResponse;
import com.vybescope.subscription.UserSettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * PUT/GET /users/{userId}/whale-alert. PUT replaces the whole config.
 */
@RestController
@RequestMapping("/api/v1/users/{userId}/whale-alert")
@RequiredArgsConstructor
public class WhaleAlertController {

    private final UserSettingsService userSettingsService;

    @PutMapping
    public Mono<WhaleAlertConfigResponse> update(@PathVariable long userId,
                                                 @RequestBody @Valid WhaleAlertConfigRequest request) {
        boolean enabled = request.enabled() == null || request.enabled();
        return Mono.fromCallable(() -> WhaleAlertConfigResponse.from(
                        userSettingsService.updateWhaleAlert(userId, request.tokens(), request.threshold(), enabled)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public WhaleAlertConfigResponse get(@PathVariable long userId) {
        return WhaleAlertConfigResponse.from(userSettingsService.getWhaleAlert(userId));
    }
}
