package com.incoresoft.presenceTracker.domain.session.service;

import com.incoresoft.presenceTracker.config.PresenceProps;
import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;
import com.incoresoft.presenceTracker.domain.emotion.service.EmotionClassifier;
import com.incoresoft.presenceTracker.domain.history.dto.DetectionEvent;
import com.incoresoft.presenceTracker.domain.history.dto.DetectionOutcome;
import com.incoresoft.presenceTracker.domain.history.service.HistoryLedger;
import com.incoresoft.presenceTracker.domain.matching.dto.MatchClass;
import com.incoresoft.presenceTracker.domain.matching.dto.MatchResult;
import com.incoresoft.presenceTracker.domain.matching.service.MatchScorer;
import com.incoresoft.presenceTracker.domain.motion.service.MotionTracker;
import com.incoresoft.presenceTracker.domain.report.dto.UnknownIncident;
import com.incoresoft.presenceTracker.domain.report.dto.VerifiedVisit;
import com.incoresoft.presenceTracker.domain.report.service.ReportSink;
import com.incoresoft.presenceTracker.domain.session.dto.ObservedFace;
import com.incoresoft.presenceTracker.domain.session.dto.PresenceSnapshot;
import com.incoresoft.presenceTracker.domain.session.dto.SessionTransition;
import com.incoresoft.presenceTracker.domain.session.dto.SessionUpdate;
import com.incoresoft.presenceTracker.domain.shared.dto.DetectedFaceDto;
import com.incoresoft.presenceTracker.domain.shared.exception.IdentityNotFoundException;
import com.incoresoft.presenceTracker.domain.shared.service.ImagePayloads;
import com.incoresoft.presenceTracker.domain.identity.service.IdentityStore;
import com.incoresoft.presenceTracker.repository.FaceApiRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-frame pipeline: match, track motion, drive the presence session, then log and report.
 * Every face yields exactly one {@link DetectionEvent}, which is always appended to the ledger.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FrameProcessingService {
    /** Fewer jitters than registration, frames must stay cheap. */
    static final int FRAME_JITTERS = 5;

    private final MatchScorer matchScorer;
    private final MotionTracker motionTracker;
    private final PresenceSessionRegistry sessions;
    private final HistoryLedger ledger;
    private final ReportSink reportSink;
    private final EmotionClassifier emotionClassifier;
    private final FaceApiRepository faceApi;
    private final IdentityStore store;
    private final PresenceProps props;
    private final Clock clock;

    /** Runs the detector on a whole frame, then processes the faces it found. */
    public List<DetectionEvent> processImage(String base64Image) {
        byte[] image = ImagePayloads.decode(base64Image);
        List<DetectedFaceDto> detected = faceApi.detectFaces(image, FRAME_JITTERS);
        return processDetections(detected);
    }

    public List<DetectionEvent> processDetections(List<DetectedFaceDto> detected) {
        List<ObservedFace> faces = new ArrayList<>(detected.size());
        for (DetectedFaceDto d : detected) {
            faces.add(new ObservedFace(d.getLocation(), ImagePayloads.toVector(d.getEncoding()),
                    ImagePayloads.decodeOptional(d.getFaceImage())));
        }
        return processFrame(faces);
    }

    public List<DetectionEvent> processFrame(List<ObservedFace> faces) {
        Instant now = clock.instant();
        List<DetectionEvent> events = new ArrayList<>(faces.size());
        for (ObservedFace face : faces) {
            events.add(processFace(face, now));
        }
        return events;
    }

    public PresenceSnapshot sessionSnapshot(String identityName) {
        if (!store.contains(identityName)) throw new IdentityNotFoundException(identityName);
        return sessions.snapshot(identityName)
                .orElseGet(() -> new PresenceSession(identityName).snapshot());
    }

    private DetectionEvent processFace(ObservedFace face, Instant now) {
        Emotion emotion = face.croppedImage().length == 0
                ? Emotion.NEUTRAL
                : emotionClassifier.classify(face.croppedImage());
        return processFace(face, emotion, now);
    }

    private DetectionEvent processFace(ObservedFace face, Emotion emotion, Instant now) {
        MatchResult match = matchScorer.match(face.featureVector());
        MatchClass matchClass = matchScorer.classify(match);
        boolean known = matchClass == MatchClass.KNOWN;

        double motion;
        PresenceSnapshot session = null;
        double cumulativeMotion;
        if (known) {
            String name = match.identityName();
            Optional<Sighting> sighting = store.whileRegistered(name, () -> {
                double moved = motionTracker.update(name, face.boundingBox().center());
                return new Sighting(moved, sessions.sessionFor(name)
                        .onKnownSighting(now, props.getActivationWindow(), moved, emotion));
            });
            if (sighting.isEmpty()) {
                log.debug("Identity {} was removed while the frame was scored, matching again", name);
                return processFace(face, emotion, now);
            }
            motion = sighting.get().motion();
            SessionUpdate update = sighting.get().update();
            logTransition(name, update.transition());
            session = update.snapshot();
            cumulativeMotion = session.cumulativeMotion();
        } else {
            motion = motionTracker.update(MotionTracker.UNKNOWN_KEY, face.boundingBox().center());
            if (match.hasCandidate()) {
                sessions.find(match.identityName())
                        .map(PresenceSession::onMiss)
                        .ifPresent(t -> logTransition(match.identityName(), t));
            }
            cumulativeMotion = motionTracker.total(MotionTracker.UNKNOWN_KEY);
        }

        log.debug("Best match: {}, similarity: {}, class: {}, motion: {}",
                match.identityName(), match.similarity(), matchClass, motion);

        DetectionOutcome outcome;
        if (session != null && session.isConfirmed()) {
            outcome = DetectionOutcome.VERIFIED;
            reportSink.writeVerified(new VerifiedVisit(match.identityName(), match.similarity(),
                    session.dominantEmotion().orElse(emotion), cumulativeMotion, session.confirmedFor(now), now));
        } else if (matchClass == MatchClass.UNKNOWN) {
            outcome = DetectionOutcome.UNKNOWN_INCIDENT;
            reportSink.writeUnknown(new UnknownIncident(match.similarity(), emotion, face.croppedImage(),
                    cumulativeMotion, now));
        } else {
            outcome = DetectionOutcome.OBSERVED;
        }

        DetectionEvent event = new DetectionEvent(
                known ? match.identityName() : DetectionEvent.UNKNOWN_LABEL,
                match.similarity(), emotion, motion, cumulativeMotion, known, matchClass, outcome,
                face.boundingBox(), now);
        ledger.append(event);
        return event;
    }

    private static void logTransition(String identityName, SessionTransition transition) {
        switch (transition) {
            case STARTED -> log.info("User {} detection started...", identityName);
            case CONFIRMED -> log.info("User {} confirmed and system activated.", identityName);
            case CLEARED -> log.info("User {} pending detection cleared", identityName);
            case NONE -> { }
        }
    }

    private record Sighting(double motion, SessionUpdate update) {
    }
}
