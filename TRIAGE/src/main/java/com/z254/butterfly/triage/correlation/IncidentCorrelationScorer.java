package com.z254.butterfly.triage.correlation;

import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.AlertCorrelation;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.domain.model.Severity;
import com.z254.butterfly.triage.domain.repository.AlertCorrelationRepository;
import com.z254.butterfly.triage.domain.repository.IncidentGroupRepository;
import com.z254.butterfly.triage.observability.TriageMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores how strongly other incident groups relate to one target group right now.
 * <p>
 * Candidates are the workspace's groups first seen within {@code timeWindow} of the target.
 * The score is a weighted sum:
 * <ul>
 *     <li>time proximity, {@code max(0, 1 - |dt| / window) * 0.4}</li>
 *     <li>same environment, 0.2</li>
 *     <li>same project, 0.2</li>
 *     <li>same severity, 0.1</li>
 *     <li>same status, 0.1</li>
 * </ul>
 */
@Slf4j
@Service
public class IncidentCorrelationScorer {

    static final double TIME_WEIGHT = 0.4;
    static final double ENVIRONMENT_WEIGHT = 0.2;
    static final double PROJECT_WEIGHT = 0.2;
    static final double SEVERITY_WEIGHT = 0.1;
    static final double STATUS_WEIGHT = 0.1;

    private static final long TIME_PROXIMITY_MS = Duration.ofMinutes(1).toMillis();
    private static final double HIGH_CORRELATION_SCORE = 0.8;

    private final IncidentGroupRepository groupRepository;
    private final AlertCorrelationRepository correlationRepository;
    private final TriageProperties triageProperties;
    private final TriageMetrics metrics;
    private final Clock clock;

    public IncidentCorrelationScorer(IncidentGroupRepository groupRepository,
                                     AlertCorrelationRepository correlationRepository,
                                     TriageProperties triageProperties,
                                     TriageMetrics metrics,
                                     Clock clock) {
        this.groupRepository = groupRepository;
        this.correlationRepository = correlationRepository;
        this.triageProperties = triageProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * All candidates scoring at least {@code minimumScore}, best first. The top ones are
     * also stored as {@link AlertCorrelation} edges.
     */
    public List<CorrelatedIncident> findCorrelatedAlerts(String groupId) {
        Optional<IncidentGroup> found = groupRepository.findById(groupId);
        if (found.isEmpty()) {
            return Collections.emptyList();
        }
        IncidentGroup target = found.get();
        TriageProperties.Correlation.Scoring config = triageProperties.getCorrelation().getScoring();
        Duration window = config.getTimeWindow();

        Timer.Sample sample = metrics.startScoringTimer();
        List<IncidentGroup> candidates = groupRepository.findFirstSeenBetween(target.getWorkspaceId(),
                target.getFirstSeenAt().minus(window), target.getFirstSeenAt().plus(window));

        List<CorrelatedIncident> correlated = new ArrayList<>();
        for (IncidentGroup candidate : candidates) {
            if (candidate.getId().equals(target.getId())) {
                continue;
            }
            double score = score(target, candidate, window);
            if (score >= config.getMinimumScore()) {
                correlated.add(new CorrelatedIncident(candidate, score, reasonFor(target, candidate, score)));
                metrics.recordCorrelationScore(score);
            }
        }
        correlated.sort(Comparator.comparingDouble(CorrelatedIncident::score).reversed());

        correlated.stream()
                .limit(config.getMaxPersisted())
                .forEach(c -> storeCorrelation(target.getId(), c));

        metrics.recordScoringCompleted(sample, correlated.size());
        return correlated;
    }

    /**
     * Pick the earliest correlated incident as the likely root cause.
     * Candidates not strictly earlier than the target keep only part of their score.
     */
    public RootCauseSuggestion suggestRootCause(String groupId) {
        List<CorrelatedIncident> correlations = findCorrelatedAlerts(groupId);
        if (correlations.isEmpty()) {
            return RootCauseSuggestion.none();
        }
        Optional<IncidentGroup> target = groupRepository.findById(groupId);
        if (target.isEmpty()) {
            return RootCauseSuggestion.none();
        }

        CorrelatedIncident candidate = correlations.stream()
                .min(Comparator.comparing(c -> c.group().getFirstSeenAt()))
                .orElseThrow();
        IncidentGroup cause = candidate.group();
        Instant targetFirstSeen = target.get().getFirstSeenAt();

        boolean earlier = cause.getFirstSeenAt().isBefore(targetFirstSeen);
        double confidence = earlier
                ? candidate.score()
                : candidate.score() * triageProperties.getCorrelation().getScoring().getLateRootCausePenalty();

        String explanation;
        if (earlier) {
            long seconds = Duration.between(cause.getFirstSeenAt(), targetFirstSeen).toSeconds();
            explanation = String.format(Locale.ROOT, "Alert \"%s\" occurred %ds earlier in the same %s environment",
                    cause.getTitle(), seconds, cause.getEnvironment());
            if (cause.getSeverity() == Severity.CRITICAL) {
                explanation += " with CRITICAL severity";
            }
        } else {
            explanation = String.format(Locale.ROOT, "Highly correlated with \"%s\" (score: %.2f)",
                    cause.getTitle(), candidate.score());
        }

        return new RootCauseSuggestion(cause.getId(), confidence, explanation);
    }

    /**
     * Stored edges touching the group, best first.
     */
    public List<AlertCorrelation> getStoredCorrelations(String groupId) {
        return correlationRepository.findInvolving(groupId);
    }

    static double score(IncidentGroup target, IncidentGroup candidate, Duration window) {
        long deltaMs = Math.abs(Duration.between(target.getFirstSeenAt(), candidate.getFirstSeenAt()).toMillis());
        double score = Math.max(0, 1 - (double) deltaMs / window.toMillis()) * TIME_WEIGHT;

        if (Objects.equals(target.getEnvironment(), candidate.getEnvironment())) {
            score += ENVIRONMENT_WEIGHT;
        }
        if (Objects.equals(target.getProject(), candidate.getProject())) {
            score += PROJECT_WEIGHT;
        }
        if (target.getSeverity() == candidate.getSeverity()) {
            score += SEVERITY_WEIGHT;
        }
        if (target.getStatus() == candidate.getStatus()) {
            score += STATUS_WEIGHT;
        }
        return score;
    }

    static String reasonFor(IncidentGroup target, IncidentGroup candidate, double score) {
        List<String> reasons = new ArrayList<>();

        long deltaMs = Math.abs(Duration.between(target.getFirstSeenAt(), candidate.getFirstSeenAt()).toMillis());
        if (deltaMs < TIME_PROXIMITY_MS) {
            reasons.add("time_proximity");
        }

        boolean sameEnvironment = Objects.equals(target.getEnvironment(), candidate.getEnvironment());
        if (sameEnvironment && Objects.equals(target.getProject(), candidate.getProject())) {
            reasons.add("same_service");
        } else if (sameEnvironment) {
            reasons.add("same_environment");
        }

        if (target.getSeverity() == Severity.CRITICAL || candidate.getSeverity() == Severity.CRITICAL) {
            reasons.add("critical_severity");
        }
        if (score > HIGH_CORRELATION_SCORE) {
            reasons.add("high_correlation");
        }

        return reasons.isEmpty() ? "general_correlation" : String.join(", ", reasons);
    }

    private void storeCorrelation(String primaryId, CorrelatedIncident correlated) {
        try {
            correlationRepository.upsert(AlertCorrelation.builder()
                    .primaryAlertId(primaryId)
                    .relatedAlertId(correlated.group().getId())
                    .score(correlated.score())
                    .reason(correlated.reason())
                    .updatedAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            metrics.recordSideEffectFailure("correlation");
            log.warn("Failed to store correlation {} -> {}: {}",
                    primaryId, correlated.group().getId(), e.getMessage());
        }
    }
}
