package com.z254.butterfly.triage.kafka;

import com.z254.butterfly.triage.audit.AuditSink;
import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.AuditFact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes audit facts to the audit topic, keyed by workspace.
 */
@Slf4j
@Component
public class KafkaAuditSink implements AuditSink {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final TriageProperties triageProperties;

    public KafkaAuditSink(KafkaTemplate<String, Object> kafkaTemplate, TriageProperties triageProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.triageProperties = triageProperties;
    }

    @Override
    public void emit(AuditFact fact) {
        String topic = triageProperties.getKafka().getAuditTopic();
        kafkaTemplate.send(topic, fact.getWorkspaceId(), fact)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to emit audit fact: action={}, resourceId={}, error={}",
                                fact.getAction(), fact.getResourceId(), ex.getMessage());
                    } else {
                        log.info("Emitted audit fact: action={}, topic={}, partition={}",
                                fact.getAction(), topic, result.getRecordMetadata().partition());
                    }
                });
    }
}
