package com.z254.butterfly.triage.kafka;

import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.GroupChangedEvent;
import com.z254.butterfly.triage.grouping.GroupUpsertResult;
import com.z254.butterfly.triage.observability.TriageMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Kafka producer for group-changed facts, keyed by group ID.
 * <p>
 * Publishing never fails the caller: send errors are logged and counted.
 */
@Slf4j
@Component
public class GroupChangedProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final TriageProperties triageProperties;
    private final TriageMetrics metrics;
    private final Clock clock;

    public GroupChangedProducer(KafkaTemplate<String, Object> kafkaTemplate,
                                TriageProperties triageProperties,
                                TriageMetrics metrics,
                                Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.triageProperties = triageProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public GroupChangedEvent publish(String workspaceId, GroupUpsertResult result) {
        GroupChangedEvent event = GroupChangedEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .workspaceId(workspaceId)
                .groupId(result.group().getId())
                .groupKey(result.group().getGroupKey())
                .changeType(result.created()
                        ? GroupChangedEvent.ChangeType.CREATED
                        : GroupChangedEvent.ChangeType.UPDATED)
                .status(result.group().getStatus())
                .severity(result.group().getSeverity())
                .previousSeverity(result.previousSeverity())
                .count(result.group().getCount())
                .velocityPerHour(result.group().getVelocityPerHour())
                .velocityAnomaly(result.velocityAnomaly())
                .occurredAt(clock.instant())
                .build();

        String topic = triageProperties.getKafka().getGroupChangedTopic();
        try {
            kafkaTemplate.send(topic, event.getGroupId(), event)
                    .whenComplete((sendResult, ex) -> {
                        if (ex != null) {
                            metrics.recordSideEffectFailure("group_changed");
                            log.error("Failed to publish group change: groupId={}, error={}",
                                    event.getGroupId(), ex.getMessage());
                        } else {
                            log.debug("Published group change: groupId={}, type={}, partition={}",
                                    event.getGroupId(), event.getChangeType(),
                                    sendResult.getRecordMetadata().partition());
                        }
                    });
        } catch (RuntimeException e) {
            metrics.recordSideEffectFailure("group_changed");
            log.error("Failed to publish group change: groupId={}, error={}",
                    event.getGroupId(), e.getMessage());
        }
        return event;
    }
}
