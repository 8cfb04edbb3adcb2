package com.incoresoft.presenceTracker.domain.report.service;

import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;
import com.incoresoft.presenceTracker.domain.history.dto.DetectionEvent;
import com.incoresoft.presenceTracker.domain.history.dto.DetectionOutcome;
import com.incoresoft.presenceTracker.domain.matching.dto.MatchClass;
import com.incoresoft.presenceTracker.domain.report.dto.UnknownIncident;
import com.incoresoft.presenceTracker.domain.report.dto.VerifiedVisit;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Text layout of the durable reports. Existing consumers parse these files, so field order,
 * keys and number formats must stay stable.
 * <pre>
 * verified (one block per visit, blank-line separated):
 *   Alice at 2025-08-06_22:36:38
 *   Presence duration: 12.0 seconds
 *   Dominant emotion: happy
 *   Motion: 41.3
 *   Max similarity: 83.5%
 *
 * unknown (one line per incident):
 *   unknown 20250806_223638 similarity:45.2% emotion:neutral motion:123.4
 * </pre>
 */
@Slf4j
public final class ReportFormat {
    public static final DateTimeFormatter VERIFIED_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH:mm:ss");
    public static final DateTimeFormatter UNKNOWN_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    public static final DateTimeFormatter IMAGE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private static final String AT = " at ";
    private static final String DURATION_KEY = "Presence duration:";
    private static final String EMOTION_KEY = "Dominant emotion:";
    private static final String MOTION_KEY = "Motion:";
    private static final String SIMILARITY_KEY = "Max similarity:";

    private ReportFormat() {
    }

    public static String formatVerified(VerifiedVisit visit, ZoneId zone) {
        double seconds = visit.presenceDuration().toMillis() / 1000.0;
        return visit.identityName() + AT + VERIFIED_TS.format(visit.timestamp().atZone(zone)) + "\n"
                + DURATION_KEY + " " + fmt(seconds) + " seconds\n"
                + EMOTION_KEY + " " + visit.dominantEmotion().label() + "\n"
                + MOTION_KEY + " " + fmt(visit.cumulativeMotion()) + "\n"
                + SIMILARITY_KEY + " " + fmt(visit.similarity()) + "%\n\n";
    }

    public static String formatUnknown(UnknownIncident incident, ZoneId zone) {
        return DetectionEvent.UNKNOWN_LABEL + " " + UNKNOWN_TS.format(incident.timestamp().atZone(zone))
                + " similarity:" + fmt(incident.similarity()) + "%"
                + " emotion:" + incident.emotion().label()
                + " motion:" + fmt(incident.cumulativeMotion()) + "\n";
    }

    /**
     * Rebuilds verified events from a report file. Blocks without a parsable header line are skipped.
     */
    public static List<DetectionEvent> parseVerified(String content, String identityName, ZoneId zone) {
        List<DetectionEvent> events = new ArrayList<>();
        for (String block : content.split("\\R\\s*\\R")) {
            if (block.isBlank()) continue;
            parseVerifiedBlock(block.strip(), identityName, zone).ifPresentOrElse(events::add,
                    () -> log.debug("Skipping unparsable verified block for {}: {}", identityName, block));
        }
        return events;
    }

    public static Optional<DetectionEvent> parseUnknownLine(String line, ZoneId zone) {
        String[] parts = line.strip().split("\\s+");
        if (parts.length < 2 || !DetectionEvent.UNKNOWN_LABEL.equals(parts[0])) return Optional.empty();
        Instant ts;
        try {
            ts = LocalDateTime.parse(parts[1], UNKNOWN_TS).atZone(zone).toInstant();
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
        double similarity = 0;
        double motion = 0;
        Emotion emotion = Emotion.NEUTRAL;
        for (int i = 2; i < parts.length; i++) {
            String part = parts[i];
            int colon = part.indexOf(':');
            if (colon < 0) continue;
            String key = part.substring(0, colon);
            String value = part.substring(colon + 1);
            switch (key) {
                case "similarity" -> similarity = parseNumber(value, similarity);
                case "emotion" -> emotion = Emotion.fromLabel(value).orElse(emotion);
                case "motion" -> motion = parseNumber(value, motion);
                default -> { }
            }
        }
        return Optional.of(new DetectionEvent(DetectionEvent.UNKNOWN_LABEL, similarity, emotion, 0, motion,
                false, MatchClass.UNKNOWN, DetectionOutcome.UNKNOWN_INCIDENT, null, ts));
    }

    private static Optional<DetectionEvent> parseVerifiedBlock(String block, String identityName, ZoneId zone) {
        String[] lines = block.split("\\R");
        int at = lines[0].lastIndexOf(AT);
        if (at < 0) return Optional.empty();
        Instant ts;
        try {
            ts = LocalDateTime.parse(lines[0].substring(at + AT.length()).strip(), VERIFIED_TS)
                    .atZone(zone).toInstant();
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
        double similarity = 0;
        double motion = 0;
        Emotion emotion = Emotion.NEUTRAL;
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.startsWith(SIMILARITY_KEY)) {
                similarity = parseNumber(line.substring(SIMILARITY_KEY.length()), similarity);
            } else if (line.startsWith(MOTION_KEY)) {
                motion = parseNumber(line.substring(MOTION_KEY.length()), motion);
            } else if (line.startsWith(EMOTION_KEY)) {
                emotion = Emotion.fromLabel(line.substring(EMOTION_KEY.length())).orElse(emotion);
            }
        }
        return Optional.of(new DetectionEvent(identityName, similarity, emotion, 0, motion,
                true, MatchClass.KNOWN, DetectionOutcome.VERIFIED, null, ts));
    }

    private static double parseNumber(String raw, double fallback) {
        try {
            return Double.parseDouble(raw.replace("%", "").strip());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
