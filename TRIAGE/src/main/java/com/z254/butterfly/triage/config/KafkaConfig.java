package com.z254.butterfly.triage.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka configuration for TRIAGE outbound facts.
 * <p>
 * Provides:
 * <ul>
 *     <li>JSON producer factory with idempotent configuration</li>
 *     <li>Topic definitions for group-changed and audit facts</li>
 * </ul>
 */
@Configuration
public class KafkaConfig {

    private final KafkaProperties kafkaProperties;
    private final TriageProperties triageProperties;

    public KafkaConfig(KafkaProperties kafkaProperties, TriageProperties triageProperties) {
        this.kafkaProperties = kafkaProperties;
        this.triageProperties = triageProperties;
    }

    // ==================== Producer Configuration ====================

    @Bean
    public ProducerFactory<String, Object> producerFactory() {
        Map<String, Object> props = new HashMap<>(kafkaProperties.buildProducerProperties(null));

        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        // Idempotent producer configuration
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);

        props.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, 100);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 120000);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);

        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, Object> kafkaTemplate() {
        KafkaTemplate<String, Object> template = new KafkaTemplate<>(producerFactory());
        template.setObservationEnabled(true);
        return template;
    }

    // ==================== Topic Definitions ====================

    @Bean
    public NewTopic groupChangedTopic() {
        TriageProperties.Kafka kafka = triageProperties.getKafka();
        return TopicBuilder.name(kafka.getGroupChangedTopic())
                .partitions(kafka.getPartitions())
                .replicas(kafka.getReplicationFactor())
                .config("retention.ms", "604800000") // 7 days
                .config("cleanup.policy", "delete")
                .build();
    }

    @Bean
    public NewTopic auditTopic() {
        TriageProperties.Kafka kafka = triageProperties.getKafka();
        return TopicBuilder.name(kafka.getAuditTopic())
                .partitions(kafka.getPartitions())
                .replicas(kafka.getReplicationFactor())
                .config("retention.ms", "7776000000") // 90 days
                .config("cleanup.policy", "delete")
                .build();
    }
}
