package com.incoresoft.presenceTracker.domain.identity.service;

import com.incoresoft.presenceTracker.domain.identity.dto.Identity;
import com.incoresoft.presenceTracker.domain.identity.dto.IdentityListResponse;
import com.incoresoft.presenceTracker.domain.identity.dto.IdentitySummary;
import com.incoresoft.presenceTracker.domain.motion.service.MotionTracker;
import com.incoresoft.presenceTracker.domain.session.service.PresenceSessionRegistry;
import com.incoresoft.presenceTracker.domain.shared.dto.DetectedFaceDto;
import com.incoresoft.presenceTracker.domain.shared.exception.FaceExtractionException;
import com.incoresoft.presenceTracker.domain.shared.exception.IdentityNotFoundException;
import com.incoresoft.presenceTracker.domain.shared.service.ImagePayloads;
import com.incoresoft.presenceTracker.repository.FaceApiRepository;
import com.incoresoft.presenceTracker.repository.IdentityFileRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Registration, listing and deletion of identities, with their reference images on disk.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityService {
    /** More jitters = slower but steadier reference encodings. */
    static final int REGISTRATION_JITTERS = 10;

    private final IdentityStore store;
    private final FaceApiRepository faceApi;
    private final IdentityFileRepository files;
    private final PresenceSessionRegistry sessions;
    private final MotionTracker motionTracker;

    @PostConstruct
    public void init() {
        try {
            loadStoredIdentities();
        } catch (Exception e) {
            log.warn("Exception was thrown while loading stored identities: {}", e.getMessage(), e);
        }
    }

    /**
     * Re-extracts every stored reference image. One broken identity does not stop the others.
     *
     * @return number of identities loaded
     */
    public int loadStoredIdentities() {
        int loaded = 0;
        for (String name : files.listStoredIdentities()) {
            try {
                byte[] image = files.readReferenceImage(name);
                List<DetectedFaceDto> faces = faceApi.detectFaces(image, REGISTRATION_JITTERS);
                if (faces.isEmpty()) {
                    log.warn("No face found in stored image of {}, skipped", name);
                    continue;
                }
                store.register(name, ImagePayloads.toVector(faces.get(0).getEncoding()));
                loaded++;
                log.info("Loaded user: {}", name);
            } catch (Exception e) {
                log.error("Error loading user {}: {}", name, e.getMessage());
            }
        }
        return loaded;
    }

    /**
     * Registers an identity from an image that must contain exactly one face.
     * Nothing is stored unless every check passes. Re-registration replaces the vector and restarts the session.
     */
    public IdentitySummary register(String name, String base64Image) {
        String normalized = IdentityStore.normalizeName(name);
        byte[] image = ImagePayloads.decode(base64Image);

        List<DetectedFaceDto> faces = faceApi.detectFaces(image, REGISTRATION_JITTERS);
        if (faces.isEmpty()) {
            throw new IllegalArgumentException("No face found in the image");
        }
        if (faces.size() > 1) {
            throw new IllegalArgumentException("More than one face found in the image; exactly one is required");
        }
        double[] vector = ImagePayloads.toVector(faces.get(0).getEncoding());
        if (vector.length == 0) {
            throw new FaceExtractionException("Could not extract face features");
        }

        IdentityStore.validateVector(vector);

        files.saveReferenceImage(normalized, image);
        Identity identity = store.register(normalized, vector, () -> forgetTracking(normalized));
        return identity.summary();
    }

    public IdentityListResponse list() {
        List<IdentitySummary> users = store.list();
        return new IdentityListResponse(users, users.size());
    }

    /**
     * Removes the identity with its session, motion track and storage folder.
     *
     * @throws IdentityNotFoundException when no such identity is registered
     */
    public void delete(String name) {
        if (name == null || !store.contains(name.trim())) {
            throw new IdentityNotFoundException(name);
        }
        String normalized = name.trim();
        files.deleteIdentityDir(normalized);
        store.remove(normalized, () -> forgetTracking(normalized));
        log.info("Identity {} deleted", normalized);
    }

    private void forgetTracking(String name) {
        sessions.reset(name);
        motionTracker.forget(name);
    }
}
