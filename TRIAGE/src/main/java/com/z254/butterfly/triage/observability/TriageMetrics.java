package com.z254.butterfly.triage.observability;

import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for TRIAGE service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Ingestion and grouping (alerts, groups created/updated, duplicates)</li>
 *     <li>Velocity anomalies (spike escalations, scan results, synthetic groups)</li>
 *     <li>Correlation (mining runs, rules upserted, scored correlations)</li>
 *     <li>Best-effort side effects that failed</li>
 * </ul>
 */
@Component
public class TriageMetrics {

    private final MeterRegistry meterRegistry;

    // Grouping metrics
    @Getter
    private final Counter alertsIngested;
    @Getter
    private final Counter duplicatesIgnored;
    @Getter
    private final Counter groupsCreated;
    @Getter
    private final Counter groupsUpdated;
    @Getter
    private final Counter severityAutoEscalations;
    private final Timer groupingLatency;

    // Anomaly metrics
    @Getter
    private final Counter spikeCheckFailures;
    @Getter
    private final Counter anomaliesDetected;
    @Getter
    private final Counter syntheticGroupsCreated;
    private final Timer anomalyScanDuration;

    // Correlation metrics
    @Getter
    private final Counter correlationRulesUpserted;
    @Getter
    private final Counter correlationMiningSkipped;
    private final Timer correlationMiningDuration;
    private final Timer correlationScoringLatency;
    private final DistributionSummary ruleConfidence;
    private final DistributionSummary correlationScore;

    private final Map<String, Counter> sideEffectFailures = new ConcurrentHashMap<>();

    public TriageMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.alertsIngested = Counter.builder("triage.alerts.ingested")
                .description("Alerts accepted by ingestion")
                .register(meterRegistry);
        this.duplicatesIgnored = Counter.builder("triage.alerts.duplicates")
                .description("Alerts ignored because their source event was already stored")
                .register(meterRegistry);
        this.groupsCreated = Counter.builder("triage.groups.created")
                .description("Incident groups created")
                .register(meterRegistry);
        this.groupsUpdated = Counter.builder("triage.groups.updated")
                .description("Incident groups updated by a matching alert")
                .register(meterRegistry);
        this.severityAutoEscalations = Counter.builder("triage.groups.auto_escalated")
                .description("Groups forced to HIGH by a velocity spike")
                .register(meterRegistry);
        this.groupingLatency = Timer.builder("triage.grouping.latency")
                .description("Group upsert latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);

        this.spikeCheckFailures = Counter.builder("triage.anomaly.spike_check.failures")
                .description("Spike checks that failed and were treated as not anomalous")
                .register(meterRegistry);
        this.anomaliesDetected = Counter.builder("triage.anomaly.detected")
                .description("Velocity anomalies reported by workspace scans")
                .register(meterRegistry);
        this.syntheticGroupsCreated = Counter.builder("triage.anomaly.synthetic_groups.created")
                .description("Synthetic velocity groups created")
                .register(meterRegistry);
        this.anomalyScanDuration = Timer.builder("triage.anomaly.scan.duration")
                .description("Workspace anomaly scan duration")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        this.correlationRulesUpserted = Counter.builder("triage.correlation.rules.upserted")
                .description("Correlation rules inserted or refreshed")
                .register(meterRegistry);
        this.correlationMiningSkipped = Counter.builder("triage.correlation.mining.skipped")
                .description("Mining runs skipped for insufficient events")
                .register(meterRegistry);
        this.correlationMiningDuration = Timer.builder("triage.correlation.mining.duration")
                .description("Correlation mining duration per workspace")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);
        this.correlationScoringLatency = Timer.builder("triage.correlation.scoring.latency")
                .description("Real-time correlation scoring latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.ruleConfidence = DistributionSummary.builder("triage.correlation.rules.confidence")
                .description("Confidence of upserted correlation rules")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
        this.correlationScore = DistributionSummary.builder("triage.correlation.score")
                .description("Scores of qualifying incident correlations")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);
    }

    // ========== Grouping Methods ==========

    public void recordAlertIngested() {
        alertsIngested.increment();
    }

    public void recordDuplicateIgnored() {
        duplicatesIgnored.increment();
    }

    public void recordGroupCreated() {
        groupsCreated.increment();
    }

    public void recordGroupUpdated(boolean autoEscalated) {
        groupsUpdated.increment();
        if (autoEscalated) {
            severityAutoEscalations.increment();
        }
    }

    public Timer.Sample startGroupingTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordGroupingLatency(Timer.Sample sample) {
        sample.stop(groupingLatency);
    }

    // ========== Anomaly Methods ==========

    public void recordSpikeCheckFailure() {
        spikeCheckFailures.increment();
    }

    public Timer.Sample startAnomalyScanTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordAnomalyScan(Timer.Sample sample, int anomalies) {
        sample.stop(anomalyScanDuration);
        anomaliesDetected.increment(anomalies);
    }

    public void recordSyntheticGroupCreated() {
        syntheticGroupsCreated.increment();
    }

    // ========== Correlation Methods ==========

    public Timer.Sample startMiningTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordMiningCompleted(Timer.Sample sample) {
        sample.stop(correlationMiningDuration);
    }

    public void recordMiningSkipped() {
        correlationMiningSkipped.increment();
    }

    public void recordRuleUpserted(double confidence) {
        correlationRulesUpserted.increment();
        ruleConfidence.record(confidence);
    }

    public Timer.Sample startScoringTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordScoringCompleted(Timer.Sample sample, int qualifying) {
        sample.stop(correlationScoringLatency);
        Counter.builder("triage.correlation.qualifying")
                .description("Qualifying correlations returned by the scorer")
                .register(meterRegistry)
                .increment(qualifying);
    }

    public void recordCorrelationScore(double score) {
        correlationScore.record(score);
    }

    // ========== Side Effect Methods ==========

    public void recordSideEffectFailure(String kind) {
        sideEffectFailures.computeIfAbsent(kind, k ->
                Counter.builder("triage.side_effects.failed")
                        .tag("kind", k)
                        .description("Best-effort writes that failed")
                        .register(meterRegistry))
                .increment();
    }
}
