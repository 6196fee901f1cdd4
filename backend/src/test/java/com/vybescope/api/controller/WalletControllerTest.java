package com.vybescope.api.controller;

import com.vybescope.domain.EventDirection;
import com.vybescope.domain.TransactionEvent;
import com.vybescope.domain.TransferBatch;
import com.vybescope.domain.WalletSnapshot;
import com.vybescope.ingestion.adapter.DataSourceClient;
import com.vybescope.ingestion.adapter.ProviderUnavailableException;
import com.vybescope.subscription.AddressValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = {WalletController.class, TokenController.class})
@Import({AddressValidator.class, WalletControllerTest.FixedClockConfig.class})
class WalletControllerTest {

    private static final String WALLET = "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM";
    private static final String USDC = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";
    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    DataSourceClient dataSourceClient;

    @Test
    void snapshot_returnsProviderBalances() {
        when(dataSourceClient.getWalletSnapshot(WALLET)).thenReturn(new WalletSnapshot(
                WALLET, new BigDecimal("150"), new BigDecimal("-2"), 1,
                List.of(new WalletSnapshot.TokenBalance(USDC, "USDC", "USD Coin",
                        new BigDecimal("150"), new BigDecimal("150"), BigDecimal.ONE, BigDecimal.ZERO))));

        webTestClient.get().uri("/api/v1/wallets/" + WALLET + "/snapshot")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ownerAddress").isEqualTo(WALLET)
                .jsonPath("$.tokenCount").isEqualTo(1)
                .jsonPath("$.tokens[0].symbol").isEqualTo("USDC");
    }

    @Test
    @DisplayName("provider outage on a passthrough read returns 503 PROVIDER_UNAVAILABLE")
    void snapshot_providerUnavailable_returns503() {
        when(dataSourceClient.getWalletSnapshot(WALLET))
                .thenThrow(new ProviderUnavailableException("HTTP 502", 502, null));

        webTestClient.get().uri("/api/v1/wallets/" + WALLET + "/snapshot")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("PROVIDER_UNAVAILABLE");
    }

    @Test
    void snapshot_invalidAddress_returns400() {
        webTestClient.get().uri("/api/v1/wallets/not-a-wallet/snapshot")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");
    }

    @Test
    void transactions_defaultWindowIs24Hours() {
        TransactionEvent event = new TransactionEvent(
                TransactionEvent.deriveEventId("sig", USDC, EventDirection.IN, WALLET),
                WALLET, "sig", USDC, "USDC", BigDecimal.TEN, BigDecimal.TEN, NOW.minusSeconds(60),
                EventDirection.IN, "sender", WALLET);
        when(dataSourceClient.getWalletTransactions(WALLET, NOW.minusSeconds(24 * 3600)))
                .thenReturn(TransferBatch.of(List.of(event)));

        webTestClient.get().uri("/api/v1/wallets/" + WALLET + "/transactions")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].signature").isEqualTo("sig")
                .jsonPath("$[0].direction").isEqualTo("IN");

        verify(dataSourceClient).getWalletTransactions(WALLET, NOW.minusSeconds(24 * 3600));
    }

    @Test
    void transactions_hoursOutOfRange_returns400() {
        webTestClient.get().uri("/api/v1/wallets/" + WALLET + "/transactions?hours=0")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }

    @Test
    void tokenStats_invalidMint_returns400() {
        webTestClient.get().uri("/api/v1/tokens/xyz/stats")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");
    }

    @Test
    void topHolders_defaultCountIsFive() {
        when(dataSourceClient.getTopTokenHolders(USDC, 5)).thenReturn(List.of());

        webTestClient.get().uri("/api/v1/tokens/" + USDC + "/top-holders")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$").isEmpty();

        verify(dataSourceClient).getTopTokenHolders(USDC, 5);
    }
}
