package com.vybescope.alert.config;

import com.vybescope.alert.CycleType;
import com.vybescope.common.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PollScheduleTest {

    @Test
    void from_defaults_twoMinuteIntervalsAndDayRetention() {
        PollSchedule schedule = PollSchedule.from(new AlertProperties());

        assertThat(schedule.walletTracking().interval()).isEqualTo(Duration.ofSeconds(120));
        assertThat(schedule.whaleAlert().interval()).isEqualTo(Duration.ofSeconds(120));
        assertThat(schedule.walletTracking().initialDelay()).isEqualTo(Duration.ofSeconds(120));
        assertThat(schedule.walletTracking().initialLookback()).isEqualTo(Duration.ofSeconds(120));
        assertThat(schedule.dedupRetention()).isEqualTo(Duration.ofHours(24));
        assertThat(schedule.settingsFor(CycleType.WHALE_ALERT)).isSameAs(schedule.whaleAlert());
    }

    @Test
    void from_zeroInterval_throwsConfigurationException() {
        AlertProperties properties = new AlertProperties();
        properties.getWalletTracking().setIntervalSeconds(0);

        assertThatThrownBy(() -> PollSchedule.from(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("wallet-tracking");
    }

    @Test
    void from_negativeInterval_throwsConfigurationException() {
        AlertProperties properties = new AlertProperties();
        properties.getWhaleAlert().setIntervalSeconds(-5);

        assertThatThrownBy(() -> PollSchedule.from(properties))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("whale-alert");
    }

    @Test
    void from_longIntervals_retentionScalesWithTicks() {
        AlertProperties properties = new AlertProperties();
        properties.getWhaleAlert().setIntervalSeconds(3_600);
        properties.getDedup().setRetentionTicks(48);

        assertThat(PollSchedule.from(properties).dedupRetention()).isEqualTo(Duration.ofHours(48));
    }

    @Test
    void from_explicitInitialDelayAndLookback_areKept() {
        AlertProperties properties = new AlertProperties();
        properties.getWalletTracking().setInitialDelaySeconds(0);
        properties.getWalletTracking().setInitialLookbackSeconds(600);

        PollSchedule schedule = PollSchedule.from(properties);

        assertThat(schedule.walletTracking().initialDelay()).isZero();
        assertThat(schedule.walletTracking().initialLookback()).isEqualTo(Duration.ofMinutes(10));
    }
}
