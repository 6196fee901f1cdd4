package com.vybescope.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

/**
 * Persistence of user dashboards ({@code user_dashboards}); the registry is rebuilt from it at startup.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(MongoDecimalConverters.all());
    }
}
