package com.prophit.insights.config;

import java.time.Instant;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "prophit")
public record InsightsProperties(
        Anchor anchor,
        Generator generator,
        Summary summary
) {

    @ConstructorBinding
    public InsightsProperties {
        if (anchor == null) {
            anchor = new Anchor(null, null);
        }
        if (generator == null) {
            generator = new Generator(null, null, null);
        }
        if (summary == null) {
            summary = new Summary(null, null, null);
        }
    }

    public static InsightsProperties defaults() {
        return new InsightsProperties(null, null, null);
    }

    /**
     * Reference instant for every relative-date computation. Leaving {@code asOf} unset
     * anchors the host clock to the system clock instead.
     */
    public record Anchor(Instant asOf, String zone) {
        public Anchor {
            if (zone == null || zone.isBlank()) {
                zone = "UTC";
            }
            try {
                ZoneId.of(zone);
            } catch (java.time.DateTimeException ex) {
                throw new IllegalArgumentException("zone must be a valid zone id: " + zone, ex);
            }
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }

        public boolean fixed() {
            return asOf != null;
        }
    }

    public record Generator(Integer windowMonths, Long seed, Integer datasetCount) {
        public Generator {
            if (windowMonths == null) {
                windowMonths = 24;
            }
            if (datasetCount == null) {
                datasetCount = 100;
            }
            if (windowMonths <= 0) {
                throw new IllegalArgumentException("windowMonths must be positive");
            }
            if (datasetCount <= 0) {
                throw new IllegalArgumentException("datasetCount must be positive");
            }
            // seed is optional; without it every catalog build draws fresh entropy
        }

        public boolean seeded() {
            return seed != null;
        }
    }

    public record Summary(Integer liveWeeks, Integer syntheticWeeks, String fallbackCategory) {
        public Summary {
            if (liveWeeks == null) {
                liveWeeks = 4;
            }
            if (syntheticWeeks == null) {
                syntheticWeeks = 12;
            }
            if (fallbackCategory == null || fallbackCategory.isBlank()) {
                fallbackCategory = "Groceries";
            }
            if (liveWeeks < 0 || syntheticWeeks < 0) {
                throw new IllegalArgumentException("week counts must not be negative");
            }
        }
    }
}
