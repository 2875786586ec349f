package com.z254.butterfly.triage.config;

import com.z254.butterfly.triage.domain.model.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for TRIAGE service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Alert grouping window</li>
 *     <li>Velocity spike check and baseline anomaly scan</li>
 *     <li>Correlation rule mining and real-time correlation scoring</li>
 *     <li>Scheduled job cadence</li>
 *     <li>Kafka topics for outbound facts</li>
 *     <li>Known workspace members</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

    private final Grouping grouping = new Grouping();
    private final Anomaly anomaly = new Anomaly();
    private final Correlation correlation = new Correlation();
    private final Scheduler scheduler = new Scheduler();
    private final Kafka kafka = new Kafka();
    private final Directory directory = new Directory();

    /**
     * Alert deduplication settings.
     */
    @Data
    public static class Grouping {
        /** Inactivity window after which a matching alert opens a new group */
        private Duration window = Duration.ofMinutes(60);

        /** Lower bound for group age when computing velocity (6 minutes) */
        private double minVelocityHours = 0.1;
    }

    /**
     * Velocity anomaly detection settings.
     */
    @Data
    public static class Anomaly {
        /** Spike check: multiple of the long-term velocity considered anomalous */
        @Positive
        private double spikeMultiplier = 3.0;

        /** Spike check: threshold never drops below this many events per hour */
        @Positive
        private double spikeFloorPerHour = 10.0;

        /** Rolling baseline length in one-hour buckets */
        @Positive
        private int windowHours = 24;

        /** Days of same-hour history for the seasonal baseline */
        @Positive
        private int lookbackDays = 7;

        /** Scan: minimum events in the current bucket before a group is considered */
        private double minVelocity = 5;

        /** Scan: z-score at or above which a group is anomalous */
        private double zScoreThreshold = 3.0;

        /** Scan: groups need at least this many occurrences to be candidates */
        private long candidateMinCount = 5;

        /** Scan: upper bound on groups examined per workspace per run */
        @Positive
        private int maxGroupsPerScan = 100;

        /** Source label for synthetic velocity groups */
        @NotBlank
        private String syntheticSource = "signalcraft";

        private Severity syntheticSeverity = Severity.LOW;
    }

    /**
     * Correlation engine settings.
     */
    @Data
    public static class Correlation {
        private final Mining mining = new Mining();
        private final Scoring scoring = new Scoring();

        @Data
        public static class Mining {
            /** History scanned by each mining run */
            private Duration lookback = Duration.ofHours(24);

            /** Look-ahead window for "B follows A" */
            private Duration followWindow = Duration.ofMinutes(5);

            /** Runs with fewer events are skipped */
            private int minEvents = 10;

            /** Minimum co-occurrences for a pair to become a rule */
            private int minSupport = 3;

            @DecimalMin("0.0")
            @DecimalMax("1.0")
            private double minConfidence = 0.5;

            /** Maximum related groups returned by rule lookup */
            private int relatedLimit = 5;
        }

        @Data
        public static class Scoring {
            /** Candidates must be first seen within this distance of the target */
            private Duration timeWindow = Duration.ofMinutes(5);

            @DecimalMin("0.0")
            @DecimalMax("1.0")
            private double minimumScore = 0.5;

            /** Number of top correlations persisted per query */
            private int maxPersisted = 10;

            /** Applied to root-cause confidence when the candidate is not earlier than the target */
            private double lateRootCausePenalty = 0.7;
        }
    }

    /**
     * Background job cadence.
     */
    @Data
    public static class Scheduler {
        private boolean correlationMiningEnabled = true;
        private Duration correlationMiningInterval = Duration.ofHours(1);
        private boolean anomalyScanEnabled = true;
        private Duration anomalyScanInterval = Duration.ofMinutes(15);
    }

    /**
     * Kafka topics.
     */
    @Data
    public static class Kafka {
        @NotBlank
        private String groupChangedTopic = "triage.groups.changed";

        @NotBlank
        private String auditTopic = "triage.audit.facts";

        private int partitions = 6;
        private int replicationFactor = 1;
    }

    /**
     * Workspace members known at startup, keyed by workspace id. One of them acts for
     * system-initiated audit facts.
     */
    @Data
    public static class Directory {
        private Map<String, List<String>> members = new LinkedHashMap<>();
    }
}
