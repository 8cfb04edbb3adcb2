package com.incoresoft.presenceTracker.domain.identity.service;

import com.incoresoft.presenceTracker.domain.identity.dto.Identity;
import com.incoresoft.presenceTracker.domain.identity.dto.IdentitySummary;
import com.incoresoft.presenceTracker.domain.motion.service.MotionTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory registry of identities, iterated in registration order.
 * Whole-store read/write lock: matchers read a consistent snapshot, registration and removal are exclusive.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdentityStore {

    private final Clock clock;
    private final Map<String, Identity> identities = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Registers or replaces an identity. A replaced identity moves to the end of the registration order.
     *
     * @throws IllegalArgumentException if the name or the vector is unusable
     */
    public Identity register(String name, double[] featureVector) {
        return register(name, featureVector, () -> { });
    }

    /**
     * Same as {@link #register(String, double[])}; {@code onRegistered} runs under the write lock,
     * so no sighting of the old vector can interleave with it.
     */
    public Identity register(String name, double[] featureVector, Runnable onRegistered) {
        String normalized = normalizeName(name);
        validateVector(featureVector);
        Identity identity = new Identity(normalized, featureVector, clock.instant());
        lock.writeLock().lock();
        try {
            boolean replaced = identities.remove(normalized) != null;
            identities.put(normalized, identity);
            onRegistered.run();
            log.info("Identity {} {}", normalized, replaced ? "re-registered" : "registered");
        } finally {
            lock.writeLock().unlock();
        }
        return identity;
    }

    /** @return false when no identity with that name exists */
    public boolean remove(String name) {
        return remove(name, () -> { });
    }

    /**
     * Removes the identity and runs {@code cascade} under the same write lock when it existed.
     * Work started through {@link #whileRegistered} either finishes before the cascade or never runs.
     */
    public boolean remove(String name, Runnable cascade) {
        lock.writeLock().lock();
        try {
            if (identities.remove(name) == null) {
                return false;
            }
            cascade.run();
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs {@code action} under the read lock if the identity is still registered.
     *
     * @return empty when the identity is gone
     */
    public <T> Optional<T> whileRegistered(String name, Supplier<T> action) {
        lock.readLock().lock();
        try {
            return identities.containsKey(name) ? Optional.ofNullable(action.get()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Identity> get(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(identities.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String name) {
        return get(name).isPresent();
    }

    public List<IdentitySummary> list() {
        lock.readLock().lock();
        try {
            return identities.values().stream().map(Identity::summary).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Consistent copy for scoring, in registration order. */
    public List<Identity> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(identities.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return identities.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Names double as folder names and report headers, so separators, dot segments and control characters are rejected.
     * The unknown label is reserved for unresolved faces.
     */
    public static String normalizeName(String name) {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("Identity name is required");
        }
        String trimmed = name.trim();
        if (trimmed.chars().anyMatch(Character::isISOControl)) {
            throw new IllegalArgumentException("Identity name must not contain control characters");
        }
        if (trimmed.contains("/") || trimmed.contains("\\") || trimmed.contains("..")) {
            throw new IllegalArgumentException("Identity name must not contain path separators: " + trimmed);
        }
        if (MotionTracker.UNKNOWN_KEY.equalsIgnoreCase(trimmed)) {
            throw new IllegalArgumentException("Identity name '" + trimmed + "' is reserved");
        }
        return trimmed;
    }

    static void validateVector(double[] featureVector) {
        if (featureVector == null || featureVector.length == 0) {
            throw new IllegalArgumentException("Feature vector is required");
        }
        for (double v : featureVector) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("Feature vector contains non-finite values");
            }
        }
    }
}
