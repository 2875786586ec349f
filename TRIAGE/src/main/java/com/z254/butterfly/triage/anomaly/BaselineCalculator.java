package com.z254.butterfly.triage.anomaly;

import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.AlertEvent;
import com.z254.butterfly.triage.domain.model.AnomalyBaseline;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.domain.repository.AlertEventRepository;
import com.z254.butterfly.triage.domain.repository.AnomalyBaselineRepository;
import com.z254.butterfly.triage.domain.repository.IncidentGroupRepository;
import com.z254.butterfly.triage.observability.TriageMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Computes hourly velocity baselines for incident groups and stores them.
 * <p>
 * The rolling baseline buckets the trailing {@code windowHours} into one-hour buckets. The
 * seasonal baseline takes, for each of the previous {@code lookbackDays}, the bucket for the
 * current hour of day (UTC). When any seasonal bucket has events it replaces the rolling one.
 */
@Slf4j
@Component
public class BaselineCalculator {

    private static final long HOUR_MS = Duration.ofHours(1).toMillis();

    private final IncidentGroupRepository groupRepository;
    private final AlertEventRepository eventRepository;
    private final AnomalyBaselineRepository baselineRepository;
    private final TriageProperties triageProperties;
    private final TriageMetrics metrics;
    private final Clock clock;

    public BaselineCalculator(IncidentGroupRepository groupRepository,
                              AlertEventRepository eventRepository,
                              AnomalyBaselineRepository baselineRepository,
                              TriageProperties triageProperties,
                              TriageMetrics metrics,
                              Clock clock) {
        this.groupRepository = groupRepository;
        this.eventRepository = eventRepository;
        this.baselineRepository = baselineRepository;
        this.triageProperties = triageProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Compute the group's statistics and upsert its baseline.
     *
     * @return empty when the group does not exist in the workspace
     */
    public Optional<GroupStats> computeGroupStats(String workspaceId, String groupId) {
        Optional<IncidentGroup> group = groupRepository.findById(groupId)
                .filter(g -> g.getWorkspaceId().equals(workspaceId));
        if (group.isEmpty()) {
            return Optional.empty();
        }

        int windowHours = triageProperties.getAnomaly().getWindowHours();
        int lookbackDays = triageProperties.getAnomaly().getLookbackDays();
        Instant now = clock.instant();
        Instant currentHour = now.atOffset(ZoneOffset.UTC).truncatedTo(ChronoUnit.HOURS).toInstant();

        Instant rollingStart = now.minus(Duration.ofHours(windowHours));
        Instant seasonalStart = currentHour.minus(Duration.ofDays(lookbackDays));
        Instant from = rollingStart.isBefore(seasonalStart) ? rollingStart : seasonalStart;
        List<AlertEvent> events = eventRepository.findByGroupBetween(workspaceId, groupId, from, now.plusNanos(1));

        long[] rolling = rollingBuckets(events, now, windowHours);
        long[] seasonal = seasonalBuckets(events, currentHour, lookbackDays);

        double rollingMean = mean(rolling);
        double rollingStdDev = stdDev(rolling, rollingMean);
        boolean hasSeasonal = sum(seasonal) > 0;
        double seasonalMean = hasSeasonal ? mean(seasonal) : 0;
        double seasonalStdDev = hasSeasonal ? stdDev(seasonal, seasonalMean) : 0;

        GroupStats stats = hasSeasonal
                ? new GroupStats(seasonalMean, seasonalStdDev, rolling[0], true)
                : new GroupStats(rollingMean, rollingStdDev, rolling[0], false);

        saveBaseline(AnomalyBaseline.builder()
                .workspaceId(workspaceId)
                .metricKey(AnomalyBaseline.metricKeyForGroup(groupId))
                .mean(stats.mean())
                .stdDev(stats.stdDev())
                .seasonalMean(hasSeasonal ? seasonalMean : null)
                .seasonalStdDev(hasSeasonal ? seasonalStdDev : null)
                .seasonalHour(hasSeasonal ? currentHour.atOffset(ZoneOffset.UTC).getHour() : null)
                .sampleCount(hasSeasonal ? seasonal.length : rolling.length)
                .windowHours(windowHours)
                .lastUpdated(now)
                .build());

        return Optional.of(stats);
    }

    /**
     * Bucket 0 holds the most recent hour {@code (now - 1h, now]}.
     */
    static long[] rollingBuckets(List<AlertEvent> events, Instant now, int windowHours) {
        long[] buckets = new long[windowHours];
        for (AlertEvent event : events) {
            long ageMs = now.toEpochMilli() - event.getOccurredAt().toEpochMilli();
            if (ageMs < 0) {
                continue;
            }
            int index = (int) (ageMs / HOUR_MS);
            if (index < windowHours) {
                buckets[index]++;
            }
        }
        return buckets;
    }

    /**
     * Bucket {@code d - 1} holds the current hour of day, {@code d} days ago.
     */
    static long[] seasonalBuckets(List<AlertEvent> events, Instant currentHour, int lookbackDays) {
        long[] buckets = new long[lookbackDays];
        for (int day = 1; day <= lookbackDays; day++) {
            Instant start = currentHour.minus(Duration.ofDays(day));
            Instant end = start.plus(Duration.ofHours(1));
            buckets[day - 1] = events.stream()
                    .filter(e -> !e.getOccurredAt().isBefore(start) && e.getOccurredAt().isBefore(end))
                    .count();
        }
        return buckets;
    }

    static double mean(long[] values) {
        return values.length == 0 ? 0 : (double) sum(values) / values.length;
    }

    static double stdDev(long[] values, double mean) {
        if (values.length == 0) {
            return 0;
        }
        double squares = 0;
        for (long value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / values.length);
    }

    private static long sum(long[] values) {
        long total = 0;
        for (long value : values) {
            total += value;
        }
        return total;
    }

    private void saveBaseline(AnomalyBaseline baseline) {
        try {
            baselineRepository.upsert(baseline);
        } catch (RuntimeException e) {
            metrics.recordSideEffectFailure("baseline");
            log.warn("Failed to store baseline {}: {}", baseline.getMetricKey(), e.getMessage());
        }
    }
}
