package com.vybescope.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted per-user settings: tracked wallets and whale-alert config. One document per user,
 * keyed by the chat user id. The in-memory registry is authoritative while the process runs;
 * this document is its durable copy.
 */
@Document(collection = "user_dashboards")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UserDashboard {

    @Id
    @EqualsAndHashCode.Include
    private Long userId;
    private List<TrackedWallet> wallets = new ArrayList<>();
    private WhaleAlertSettings whaleAlert;
    private Instant updatedAt;

    @NoArgsConstructor
    @Getter
    @Setter
    public static class TrackedWallet {
        private String address;
        private Instant createdAt;

        public TrackedWallet(String address, Instant createdAt) {
            this.address = address;
            this.createdAt = createdAt;
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class WhaleAlertSettings {
        private List<String> tokens = new ArrayList<>();
        /** USD threshold; null means the system default. */
        private BigDecimal threshold;
        private boolean enabled;
    }
}
