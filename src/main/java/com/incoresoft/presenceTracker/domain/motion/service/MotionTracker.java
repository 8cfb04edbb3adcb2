package com.incoresoft.presenceTracker.domain.motion.service;

import com.incoresoft.presenceTracker.domain.motion.dto.FaceCenter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last known face center per tracking key (identity name, or the shared unknown key).
 * Also keeps a running total per key, used for faces that have no presence session.
 */
@Slf4j
@Component
public class MotionTracker {
    public static final String UNKNOWN_KEY = "unknown";

    private final Map<String, Track> tracks = new ConcurrentHashMap<>();

    private record Track(FaceCenter lastCenter, double total) {
    }

    /**
     * @return euclidean distance from the previous center of this key, 0 on the first sighting
     */
    public double update(String key, FaceCenter newCenter) {
        double[] delta = new double[1];
        tracks.compute(key, (k, prev) -> {
            if (prev == null) return new Track(newCenter, 0);
            delta[0] = prev.lastCenter().distanceTo(newCenter);
            return new Track(newCenter, prev.total() + delta[0]);
        });
        return delta[0];
    }

    public double total(String key) {
        Track t = tracks.get(key);
        return t == null ? 0 : t.total();
    }

    public FaceCenter lastCenter(String key) {
        Track t = tracks.get(key);
        return t == null ? null : t.lastCenter();
    }

    public void forget(String key) {
        if (tracks.remove(key) != null) {
            log.debug("Motion track dropped for {}", key);
        }
    }
}
