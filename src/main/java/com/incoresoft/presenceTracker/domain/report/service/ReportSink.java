package com.incoresoft.presenceTracker.domain.report.service;

import com.incoresoft.presenceTracker.config.PresenceProps;
import com.incoresoft.presenceTracker.domain.report.dto.UnknownIncident;
import com.incoresoft.presenceTracker.domain.report.dto.VerifiedVisit;
import com.incoresoft.presenceTracker.repository.IdentityFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/**
 * Append-only durable reports. Write failures are logged and reported as {@code false};
 * they never reach the frame pipeline. No retry: the next matching event writes again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportSink {
    public static final String VERIFIED_REPORT = "verified_user_report.txt";
    public static final String UNKNOWN_REPORT = "unknown_report.txt";
    public static final String UNKNOWN_FACES_DIR = "unknown_faces";

    private final IdentityFileRepository files;
    private final PresenceProps props;
    private final Clock clock;

    /**
     * Appends a verified visit block to the identity's report. A missing identity folder is not an error.
     */
    public synchronized boolean writeVerified(VerifiedVisit visit) {
        Path dir = files.identityDir(visit.identityName());
        if (!Files.isDirectory(dir)) {
            log.error("Verified report skipped, no storage folder for {}: {}", visit.identityName(), dir);
            return false;
        }
        try {
            append(dir.resolve(VERIFIED_REPORT), ReportFormat.formatVerified(visit, clock.getZone()));
            log.debug("Verified report saved for {} with motion {}", visit.identityName(), visit.cumulativeMotion());
            return true;
        } catch (IOException e) {
            log.error("Error saving verified report for {}", visit.identityName(), e);
            return false;
        }
    }

    /**
     * Archives the face crop and appends one incident line. The archive folder is created on demand.
     */
    public synchronized boolean writeUnknown(UnknownIncident incident) {
        Path dir = unknownDir();
        try {
            if (incident.faceImage() != null && incident.faceImage().length > 0) {
                Path faces = Files.createDirectories(dir.resolve(UNKNOWN_FACES_DIR));
                Path image = uniqueImagePath(faces, ReportFormat.IMAGE_TS.format(incident.timestamp().atZone(clock.getZone())));
                Files.write(image, incident.faceImage(), StandardOpenOption.CREATE_NEW);
            } else {
                Files.createDirectories(dir);
            }
            append(dir.resolve(UNKNOWN_REPORT), ReportFormat.formatUnknown(incident, clock.getZone()));
            log.debug("Unknown face report saved with similarity {}", incident.similarity());
            return true;
        } catch (IOException e) {
            log.error("Error saving unknown face report to {}", dir, e);
            return false;
        }
    }

    public Path unknownDir() {
        return Paths.get(props.getStorage().getUnknownDir());
    }

    private static Path uniqueImagePath(Path dir, String stamp) {
        Path candidate = dir.resolve("unknown_" + stamp + ".jpg");
        for (int i = 1; Files.exists(candidate); i++) {
            candidate = dir.resolve("unknown_" + stamp + "_" + i + ".jpg");
        }
        return candidate;
    }

    private static void append(Path file, String text) throws IOException {
        Files.writeString(file, text, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
