package com.incoresoft.presenceTracker.domain.session.service;

import com.incoresoft.presenceTracker.domain.session.dto.PresenceSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions per identity name, created lazily on first sighting.
 */
@Slf4j
@Component
public class PresenceSessionRegistry {

    private final Map<String, PresenceSession> sessions = new ConcurrentHashMap<>();

    public PresenceSession sessionFor(String identityName) {
        return sessions.computeIfAbsent(identityName, PresenceSession::new);
    }

    public Optional<PresenceSession> find(String identityName) {
        return Optional.ofNullable(sessions.get(identityName));
    }

    public Optional<PresenceSnapshot> snapshot(String identityName) {
        return find(identityName).map(PresenceSession::snapshot);
    }

    /** Drops the session; the next sighting starts again from Idle. */
    public void reset(String identityName) {
        if (sessions.remove(identityName) != null) {
            log.info("Presence session of {} reset", identityName);
        }
    }
}
