package com.incoresoft.presenceTracker.domain.identity.service;

import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;
import com.incoresoft.presenceTracker.domain.identity.dto.IdentitySummary;
import com.incoresoft.presenceTracker.domain.motion.dto.FaceCenter;
import com.incoresoft.presenceTracker.domain.motion.service.MotionTracker;
import com.incoresoft.presenceTracker.domain.session.service.PresenceSessionRegistry;
import com.incoresoft.presenceTracker.domain.shared.dto.BoundingBox;
import com.incoresoft.presenceTracker.domain.shared.dto.DetectedFaceDto;
import com.incoresoft.presenceTracker.domain.shared.exception.FaceExtractionException;
import com.incoresoft.presenceTracker.domain.shared.exception.IdentityNotFoundException;
import com.incoresoft.presenceTracker.repository.FaceApiRepository;
import com.incoresoft.presenceTracker.repository.IdentityFileRepository;
import com.incoresoft.presenceTracker.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdentityServiceTest {

    private static final String IMAGE = "AQID";

    private final IdentityStore store = new IdentityStore(new MutableClock(Instant.parse("2025-08-06T10:00:00Z")));
    private final FaceApiRepository faceApi = mock(FaceApiRepository.class);
    private final IdentityFileRepository files = mock(IdentityFileRepository.class);
    private final PresenceSessionRegistry sessions = new PresenceSessionRegistry();
    private final MotionTracker tracker = new MotionTracker();
    private final IdentityService service = new IdentityService(store, faceApi, files, sessions, tracker);

    @Test
    void registersSingleFaceWithRegistrationJitters() {
        when(faceApi.detectFaces(any(), eq(IdentityService.REGISTRATION_JITTERS))).thenReturn(List.of(face(0.1, 0.2)));

        IdentitySummary summary = service.register(" alice ", IMAGE);

        assertThat(summary.name()).isEqualTo("alice");
        assertThat(store.contains("alice")).isTrue();
        verify(files).saveReferenceImage(eq("alice"), eq(new byte[]{1, 2, 3}));
        verify(faceApi).detectFaces(any(), eq(10));
    }

    @Test
    void rejectsImagesWithoutExactlyOneFace() {
        when(faceApi.detectFaces(any(), anyInt())).thenReturn(List.of());
        assertThatThrownBy(() -> service.register("alice", IMAGE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No face");

        when(faceApi.detectFaces(any(), anyInt())).thenReturn(List.of(face(0.1), face(0.2)));
        assertThatThrownBy(() -> service.register("alice", IMAGE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exactly one");

        assertThat(store.size()).isZero();
        verify(files, never()).saveReferenceImage(any(), any());
    }

    @Test
    void emptyEncodingIsAnExtractionFailure() {
        when(faceApi.detectFaces(any(), anyInt())).thenReturn(List.of(face()));

        assertThatThrownBy(() -> service.register("alice", IMAGE)).isInstanceOf(FaceExtractionException.class);
        assertThat(store.contains("alice")).isFalse();
    }

    @Test
    void nonFiniteEncodingIsRejectedBeforeTheImageIsWritten() {
        when(faceApi.detectFaces(any(), anyInt())).thenReturn(List.of(face(0.1, Double.NaN)));

        assertThatThrownBy(() -> service.register("alice", IMAGE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-finite");
        assertThat(store.contains("alice")).isFalse();
        verify(files, never()).saveReferenceImage(any(), any());
    }

    @Test
    void invalidNameFailsBeforeCallingDetector() {
        assertThatThrownBy(() -> service.register("../x", IMAGE)).isInstanceOf(IllegalArgumentException.class);
        verify(faceApi, never()).detectFaces(any(), anyInt());
    }

    @Test
    void reRegistrationResetsSessionAndMotion() {
        when(faceApi.detectFaces(any(), anyInt())).thenReturn(List.of(face(0.1)));
        service.register("alice", IMAGE);
        sessions.sessionFor("alice").onKnownSighting(Instant.now(), Duration.ofSeconds(3), 0, Emotion.NEUTRAL);
        tracker.update("alice", new FaceCenter(1, 1));

        service.register("alice", IMAGE);

        assertThat(sessions.find("alice")).isEmpty();
        assertThat(tracker.lastCenter("alice")).isNull();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void deleteCascadesAndUnknownNameIsNotFound() {
        when(faceApi.detectFaces(any(), anyInt())).thenReturn(List.of(face(0.1)));
        service.register("alice", IMAGE);
        sessions.sessionFor("alice");

        service.delete("alice");

        assertThat(store.contains("alice")).isFalse();
        assertThat(sessions.find("alice")).isEmpty();
        verify(files).deleteIdentityDir("alice");
        assertThatThrownBy(() -> service.delete("alice")).isInstanceOf(IdentityNotFoundException.class);
    }

    @Test
    void loadsStoredIdentitiesAndSkipsBrokenOnes() {
        when(files.listStoredIdentities()).thenReturn(List.of("alice", "bob", "carol"));
        when(files.readReferenceImage("alice")).thenReturn(new byte[]{1});
        when(files.readReferenceImage("bob")).thenReturn(new byte[]{2});
        when(files.readReferenceImage("carol")).thenReturn(new byte[]{3});
        when(faceApi.detectFaces(eq(new byte[]{1}), anyInt())).thenReturn(List.of(face(0.1)));
        when(faceApi.detectFaces(eq(new byte[]{2}), anyInt())).thenReturn(List.of());
        doThrow(new FaceExtractionException("down")).when(faceApi).detectFaces(eq(new byte[]{3}), anyInt());

        assertThat(service.loadStoredIdentities()).isEqualTo(1);
        assertThat(store.list()).extracting(IdentitySummary::name).containsExactly("alice");
    }

    private static DetectedFaceDto face(Double... encoding) {
        DetectedFaceDto dto = new DetectedFaceDto();
        dto.setLocation(new BoundingBox(0, 10, 10, 0));
        dto.setEncoding(List.of(encoding));
        return dto;
    }
}
