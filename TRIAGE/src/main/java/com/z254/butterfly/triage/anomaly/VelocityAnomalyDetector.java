package com.z254.butterfly.triage.anomaly;

import com.z254.butterfly.triage.config.TriageProperties;
import com.z254.butterfly.triage.domain.model.IncidentGroup;
import com.z254.butterfly.triage.domain.repository.IncidentGroupRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Cheap velocity spike check run on the ingestion path.
 * <p>
 * A group is spiking when its current velocity exceeds
 * {@code max(longTermVelocity * spikeMultiplier, spikeFloorPerHour)}, where the long-term
 * velocity is {@code count / max(hoursActive, 1)}. The floor keeps low-volume groups quiet.
 */
@Slf4j
@Component
public class VelocityAnomalyDetector {

    private static final double MIN_ACTIVE_HOURS = 1.0;

    private final IncidentGroupRepository groupRepository;
    private final TriageProperties triageProperties;
    private final Clock clock;

    public VelocityAnomalyDetector(IncidentGroupRepository groupRepository,
                                   TriageProperties triageProperties,
                                   Clock clock) {
        this.groupRepository = groupRepository;
        this.triageProperties = triageProperties;
        this.clock = clock;
    }

    /**
     * @return true when {@code currentVelocity} is above the spike threshold; false when it is
     * not, when the group is unknown, or when the check itself fails
     */
    public boolean checkVelocityAnomaly(String workspaceId, String groupId, double currentVelocity) {
        try {
            Optional<IncidentGroup> group = findGroup(workspaceId, groupId);
            if (group.isEmpty()) {
                return false;
            }

            double threshold = spikeThreshold(group.get());
            if (currentVelocity > threshold) {
                log.warn("Velocity anomaly for group {}: {} events/h > threshold {}",
                        groupId, String.format("%.1f", currentVelocity), String.format("%.1f", threshold));
                return true;
            }
            return false;
        } catch (RuntimeException e) {
            log.error("Error checking velocity anomaly for group {}: {}", groupId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Whether the velocity stored on the group is still more than three times its long-term rate.
     */
    public boolean isAnomalyActive(String workspaceId, String groupId) {
        return findGroup(workspaceId, groupId)
                .filter(group -> group.getVelocityPerHour() != null)
                .map(group -> {
                    double baseline = longTermVelocity(group);
                    double ratio = baseline > 0 ? group.getVelocityPerHour() / baseline : 0;
                    return ratio > triageProperties.getAnomaly().getSpikeMultiplier()
                            && group.getVelocityPerHour() > triageProperties.getAnomaly().getMinVelocity();
                })
                .orElse(false);
    }

    double spikeThreshold(IncidentGroup group) {
        TriageProperties.Anomaly config = triageProperties.getAnomaly();
        return Math.max(longTermVelocity(group) * config.getSpikeMultiplier(), config.getSpikeFloorPerHour());
    }

    private double longTermVelocity(IncidentGroup group) {
        return group.getCount() / group.hoursSinceFirstSeen(clock.instant(), MIN_ACTIVE_HOURS);
    }

    private Optional<IncidentGroup> findGroup(String workspaceId, String groupId) {
        return groupRepository.findById(groupId)
                .filter(group -> group.getWorkspaceId().equals(workspaceId));
    }
}
