package com.prophit.insights.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnchorConfig {

    @Bean
    public Clock insightsClock(InsightsProperties properties) {
        InsightsProperties.Anchor anchor = properties.anchor();
        if (anchor.fixed()) {
            return Clock.fixed(anchor.asOf(), anchor.zoneId());
        }
        return Clock.system(anchor.zoneId());
    }
}
