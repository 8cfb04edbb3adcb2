package com.incoresoft.presenceTracker.domain.session.service;

import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;
import com.incoresoft.presenceTracker.domain.session.dto.PresencePhase;
import com.incoresoft.presenceTracker.domain.session.dto.PresenceSnapshot;
import com.incoresoft.presenceTracker.domain.session.dto.SessionTransition;
import com.incoresoft.presenceTracker.domain.session.dto.SessionUpdate;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Presence state machine of one identity: Idle -> Pending -> Confirmed.
 * <p>
 * The activation window is polled against the frame timestamp on every sighting; there is no timer.
 * Confirmed never demotes on its own, only {@link PresenceSessionRegistry#reset(String)} ends it.
 * All methods are atomic per session.
 */
public class PresenceSession {

    private final String identityName;
    private PresencePhase phase = PresencePhase.IDLE;
    private Instant since;
    private double cumulativeMotion;
    private final Map<Emotion, Integer> emotionCounts = new EnumMap<>(Emotion.class);

    public PresenceSession(String identityName) {
        this.identityName = identityName;
    }

    /**
     * Applies one known-candidate sighting.
     *
     * @param motion instantaneous displacement of this frame, added before any transition
     */
    public synchronized SessionUpdate onKnownSighting(Instant now, Duration activationWindow,
                                                      double motion, Emotion emotion) {
        cumulativeMotion += motion;
        SessionTransition transition = SessionTransition.NONE;

        switch (phase) {
            case IDLE -> {
                phase = PresencePhase.PENDING;
                since = now;
                transition = SessionTransition.STARTED;
            }
            case PENDING -> {
                if (Duration.between(since, now).compareTo(activationWindow) >= 0) {
                    phase = PresencePhase.CONFIRMED;
                    since = now;
                    cumulativeMotion = 0;
                    emotionCounts.clear();
                    for (Emotion e : Emotion.values()) emotionCounts.put(e, 0);
                    transition = SessionTransition.CONFIRMED;
                }
            }
            case CONFIRMED -> {
                // stays confirmed
            }
        }

        if (phase == PresencePhase.CONFIRMED) {
            emotionCounts.merge(emotion, 1, Integer::sum);
        }
        return new SessionUpdate(transition, snapshotLocked());
    }

    /**
     * Applies a frame where this identity was the best match but below the known threshold.
     * Only a pending timer is cleared.
     */
    public synchronized SessionTransition onMiss() {
        if (phase != PresencePhase.PENDING) return SessionTransition.NONE;
        phase = PresencePhase.IDLE;
        since = null;
        return SessionTransition.CLEARED;
    }

    public synchronized PresenceSnapshot snapshot() {
        return snapshotLocked();
    }

    public String getIdentityName() {
        return identityName;
    }

    private PresenceSnapshot snapshotLocked() {
        return new PresenceSnapshot(identityName, phase, since, cumulativeMotion, emotionCounts);
    }
}
