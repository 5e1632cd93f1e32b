package com.prophit.insights.config;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final InsightsProperties props;
    private final Clock clock;

    public StartupDiagnostics(InsightsProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    @PostConstruct
    void logConfig() {
        var anchor = props.anchor();
        log.info("Anchor config: fixed={}, asOf='{}', zone='{}'",
                anchor.fixed(), anchor.fixed() ? anchor.asOf() : clock.instant(), anchor.zone());

        var generator = props.generator();
        log.info("Generator config: windowMonths={}, datasetCount={}, seeded={}",
                generator.windowMonths(), generator.datasetCount(), generator.seeded());

        var summary = props.summary();
        log.info("Summary config: liveWeeks={}, syntheticWeeks={}, fallbackCategory='{}'",
                summary.liveWeeks(), summary.syntheticWeeks(), summary.fallbackCategory());
    }
}
