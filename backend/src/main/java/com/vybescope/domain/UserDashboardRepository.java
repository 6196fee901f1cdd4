package com.vybescope.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for user_dashboards. Written through by UserSettingsService, read at startup to
 * warm the subscription registry.
 */
public interface UserDashboardRepository extends MongoRepository<UserDashboard, Long> {
}
