package com.z254.butterfly.triage.correlation;

import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.AlertEvent;
import com.z254.butterfly.triage.domain.model.CorrelationRule;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.domain.repository.AlertEventRepository;
import com.z254.butterfly.triage.domain.repository.CorrelationRuleRepository;
import com.z254.butterfly.triage.domain.repository.IncidentGroupRepository;
import com.z254.butterfly.triage.observability.TriageMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mines directional "A is followed by B" rules between group keys from recent events.
 * <p>
 * Every event A is paired with each later event B of a different key that occurs within the
 * follow window. A pair becomes a rule once it has {@code minSupport} co-occurrences and
 * {@code pairCount / occurrences(A)} reaches {@code minConfidence}. The inner scan stops at the
 * first event outside the window, so the cost is proportional to events times window density.
 */
@Slf4j
@Service
public class CorrelationRuleMiner {

    private final AlertEventRepository eventRepository;
    private final IncidentGroupRepository groupRepository;
    private final CorrelationRuleRepository ruleRepository;
    private final TriageProperties triageProperties;
    private final TriageMetrics metrics;
    private final Clock clock;

    public CorrelationRuleMiner(AlertEventRepository eventRepository,
                                IncidentGroupRepository groupRepository,
                                CorrelationRuleRepository ruleRepository,
                                TriageProperties triageProperties,
                                TriageMetrics metrics,
                                Clock clock) {
        this.eventRepository = eventRepository;
        this.groupRepository = groupRepository;
        this.ruleRepository = ruleRepository;
        this.triageProperties = triageProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public MiningSummary analyzeCorrelations(String workspaceId) {
        TriageProperties.Correlation.Mining config = triageProperties.getCorrelation().getMining();
        Instant now = clock.instant();

        List<AlertEvent> events = eventRepository.findByWorkspaceSince(workspaceId, now.minus(config.getLookback()));
        if (events.size() < config.getMinEvents()) {
            metrics.recordMiningSkipped();
            log.debug("Skipping correlation mining for workspace {}: {} events", workspaceId, events.size());
            return MiningSummary.skipped(events.size());
        }

        Timer.Sample sample = metrics.startMiningTimer();
        List<KeyedEvent> keyed = resolveGroupKeys(events);
        long windowMs = config.getFollowWindow().toMillis();

        Map<KeyPair, Integer> pairCounts = new LinkedHashMap<>();
        Map<String, Integer> occurrences = new HashMap<>();

        for (int i = 0; i < keyed.size(); i++) {
            KeyedEvent a = keyed.get(i);
            occurrences.merge(a.groupKey(), 1, Integer::sum);

            for (int j = i + 1; j < keyed.size(); j++) {
                KeyedEvent b = keyed.get(j);
                if (b.occurredAtMs() - a.occurredAtMs() > windowMs) {
                    break;
                }
                if (!a.groupKey().equals(b.groupKey())) {
                    pairCounts.merge(new KeyPair(a.groupKey(), b.groupKey()), 1, Integer::sum);
                }
            }
        }

        int upserted = 0;
        for (Map.Entry<KeyPair, Integer> entry : pairCounts.entrySet()) {
            int support = entry.getValue();
            if (support < config.getMinSupport()) {
                continue;
            }
            KeyPair pair = entry.getKey();
            double confidence = (double) support / occurrences.getOrDefault(pair.source(), support);
            if (confidence < config.getMinConfidence()) {
                continue;
            }

            ruleRepository.upsert(CorrelationRule.builder()
                    .workspaceId(workspaceId)
                    .sourceGroupKey(pair.source())
                    .targetGroupKey(pair.target())
                    .confidence(confidence)
                    .lastUpdatedAt(now)
                    .build());
            metrics.recordRuleUpserted(confidence);
            upserted++;
        }

        metrics.recordMiningCompleted(sample);
        log.info("Correlation mining for workspace {} scanned {} events, {} pairs, {} rules",
                workspaceId, events.size(), pairCounts.size(), upserted);
        return new MiningSummary(events.size(), pairCounts.size(), upserted, false);
    }

    /**
     * Groups related to {@code groupId} through stored rules, in either direction.
     */
    public List<IncidentGroup> getCorrelatedGroups(String workspaceId, String groupId) {
        Optional<IncidentGroup> group = groupRepository.findById(groupId)
                .filter(g -> g.getWorkspaceId().equals(workspaceId));
        if (group.isEmpty()) {
            return Collections.emptyList();
        }

        TriageProperties.Correlation.Mining config = triageProperties.getCorrelation().getMining();
        String groupKey = group.get().getGroupKey();
        List<CorrelationRule> rules = ruleRepository.findInvolving(
                workspaceId, groupKey, config.getMinConfidence(), config.getRelatedLimit());
        if (rules.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> relatedKeys = rules.stream()
                .map(rule -> rule.counterpartOf(groupKey))
                .toList();
        return groupRepository.findByGroupKeys(workspaceId, relatedKeys, config.getRelatedLimit());
    }

    /**
     * Attach group keys to events, dropping events whose group no longer exists.
     */
    private List<KeyedEvent> resolveGroupKeys(List<AlertEvent> events) {
        Map<String, Optional<String>> keysByGroup = new HashMap<>();
        List<KeyedEvent> keyed = new ArrayList<>(events.size());
        for (AlertEvent event : events) {
            if (event.getGroupId() == null) {
                continue;
            }
            keysByGroup.computeIfAbsent(event.getGroupId(),
                            id -> groupRepository.findById(id).map(IncidentGroup::getGroupKey))
                    .ifPresent(key -> keyed.add(new KeyedEvent(key, event.getOccurredAt().toEpochMilli())));
        }
        return keyed;
    }

    private record KeyedEvent(String groupKey, long occurredAtMs) {
    }

    private record KeyPair(String source, String target) {
    }
}
