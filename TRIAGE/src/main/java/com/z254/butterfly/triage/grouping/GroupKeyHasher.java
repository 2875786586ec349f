package com.z254.butterfly.triage.grouping;

import com.z254.butterfly.triage.domain.model.NormalizedAlert;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Derives the deduplication key of an alert.
 * <p>
 * The key is the lower-case hex SHA-256 of {@code source|project|environment|fingerprint},
 * each part trimmed and lower-cased first, so case and surrounding whitespace never split a group.
 */
@Component
public class GroupKeyHasher {

    static final String DELIMITER = "|";

    public String hash(NormalizedAlert alert) {
        return hash(alert.getSource(), alert.getProject(), alert.getEnvironment(), alert.getFingerprint());
    }

    public String hash(String source, String project, String environment, String fingerprint) {
        String raw = Stream.of(source, project, environment, fingerprint)
                .map(GroupKeyHasher::normalizePart)
                .collect(Collectors.joining(DELIMITER));
        return HexFormat.of().formatHex(sha256().digest(raw.getBytes(StandardCharsets.UTF_8)));
    }

    private static String normalizePart(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
