package com.vybescope.subscription;

import com.vybescope.domain.UserDashboard;
import com.vybescope.domain.UserDashboardRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Loads persisted dashboards into the registry once the application is ready.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RegistryWarmUpService {

    private final UserDashboardRepository userDashboardRepository;
    private final SubscriptionRegistry registry;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int restored = 0;
        for (UserDashboard dashboard : userDashboardRepository.findAll()) {
            registry.restore(dashboard);
            restored++;
        }
        log.info("Restored {} user dashboards into the subscription registry", restored);
    }
}
