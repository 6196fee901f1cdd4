package com.vybescope.domain;

import com.vybescope.config.MongoConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest
@Testcontainers(disabledWithoutDocker = true)
@Import(MongoConfig.class)
class UserDashboardRepositoryIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    UserDashboardRepository userDashboardRepository;

    @Test
    @DisplayName("dashboard round-trips wallets and Decimal128 threshold")
    void saveAndFind() {
        UserDashboard dashboard = new UserDashboard();
        dashboard.setUserId(123456789L);
        dashboard.setWallets(List.of(new UserDashboard.TrackedWallet(
                "9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM", Instant.parse("2025-01-01T00:00:00Z"))));
        UserDashboard.WhaleAlertSettings whale = new UserDashboard.WhaleAlertSettings();
        whale.setTokens(List.of("EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v"));
        whale.setThreshold(new BigDecimal("12500.50"));
        whale.setEnabled(true);
        dashboard.setWhaleAlert(whale);
        dashboard.setUpdatedAt(Instant.parse("2025-01-02T00:00:00Z"));

        userDashboardRepository.save(dashboard);

        UserDashboard read = userDashboardRepository.findById(123456789L).orElseThrow();
        assertThat(read.getWallets()).singleElement()
                .satisfies(w -> assertThat(w.getAddress()).isEqualTo("9WzDXwBbmkg8ZTbNMqUxvQRAyrZzDsGYdLVL9zYtAWWM"));
        assertThat(read.getWhaleAlert().getThreshold()).isEqualByComparingTo("12500.50");
        assertThat(read.getWhaleAlert().isEnabled()).isTrue();

        userDashboardRepository.deleteById(123456789L);
        assertThat(userDashboardRepository.findById(123456789L)).isEmpty();
    }
}
