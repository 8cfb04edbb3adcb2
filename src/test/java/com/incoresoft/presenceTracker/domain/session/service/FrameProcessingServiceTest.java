package com.incoresoft.presenceTracker.domain.session.service;

import com.incoresoft.presenceTracker.config.PresenceProps;
import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;
import com.incoresoft.presenceTracker.domain.emotion.service.EmotionClassifier;
import com.incoresoft.presenceTracker.domain.history.dto.DetectionEvent;
import com.incoresoft.presenceTracker.domain.history.dto.DetectionOutcome;
import com.incoresoft.presenceTracker.domain.history.service.HistoryLedger;
import com.incoresoft.presenceTracker.domain.identity.service.IdentityService;
import com.incoresoft.presenceTracker.domain.identity.service.IdentityStore;
import com.incoresoft.presenceTracker.domain.matching.dto.MatchClass;
import com.incoresoft.presenceTracker.domain.matching.service.MatchScorer;
import com.incoresoft.presenceTracker.domain.motion.service.MotionTracker;
import com.incoresoft.presenceTracker.domain.report.service.ReportSink;
import com.incoresoft.presenceTracker.domain.session.dto.ObservedFace;
import com.incoresoft.presenceTracker.domain.session.dto.PresencePhase;
import com.incoresoft.presenceTracker.domain.shared.dto.BoundingBox;
import com.incoresoft.presenceTracker.domain.shared.dto.DetectedFaceDto;
import com.incoresoft.presenceTracker.domain.shared.exception.IdentityNotFoundException;
import com.incoresoft.presenceTracker.repository.FaceApiRepository;
import com.incoresoft.presenceTracker.repository.IdentityFileRepository;
import com.incoresoft.presenceTracker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FrameProcessingServiceTest {

    private static final Instant T0 = Instant.parse("2025-08-06T10:00:00Z");
    private static final byte[] CROP = {1, 2, 3};

    @TempDir
    Path tmp;

    private final MutableClock clock = new MutableClock(T0);
    private final PresenceProps props = new PresenceProps();
    private final IdentityStore store = new IdentityStore(clock);
    private final MotionTracker tracker = new MotionTracker();
    private final PresenceSessionRegistry sessions = new PresenceSessionRegistry();
    private final FaceApiRepository faceApi = mock(FaceApiRepository.class);
    private final EmotionClassifier emotions = face -> Emotion.HAPPY;
    private HistoryLedger ledger;
    private ReportSink sink;
    private FrameProcessingService service;

    @BeforeEach
    void setUp() {
        props.getStorage().setUsersDir(tmp.resolve("users").toString());
        props.getStorage().setUnknownDir(tmp.resolve("unknown").toString());
        ledger = new HistoryLedger(props);
        // the first vector component doubles as the similarity score
        MatchScorer scorer = new MatchScorer(store, (observed, reference) -> observed[0], props);
        sink = new ReportSink(new IdentityFileRepository(props), props, clock);
        service = new FrameProcessingService(scorer, tracker, sessions, ledger, sink, emotions,
                faceApi, store, props, clock);
    }

    @Test
    void confirmsAfterActivationWindowAndWritesVerifiedReport() throws Exception {
        registerWithFolder("alice");
        int[][] centers = {{100, 100}, {103, 104}, {103, 107}, {103, 109}};

        List<DetectionEvent> events = new ArrayList<>();
        for (int[] c : centers) {
            events.addAll(service.processFrame(List.of(face(85, c[0], c[1]))));
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(events).extracting(DetectionEvent::outcome).containsExactly(
                DetectionOutcome.OBSERVED, DetectionOutcome.OBSERVED, DetectionOutcome.OBSERVED,
                DetectionOutcome.VERIFIED);
        assertThat(events).extracting(DetectionEvent::instantaneousMotion).containsExactly(0.0, 5.0, 3.0, 2.0);
        assertThat(events).extracting(DetectionEvent::cumulativeMotion).containsExactly(0.0, 5.0, 8.0, 0.0);
        assertThat(events).allSatisfy(e -> {
            assertThat(e.identityLabel()).isEqualTo("alice");
            assertThat(e.known()).isTrue();
            assertThat(e.classification()).isEqualTo(MatchClass.KNOWN);
        });

        assertThat(service.sessionSnapshot("alice").phase()).isEqualTo(PresencePhase.CONFIRMED);
        String report = Files.readString(tmp.resolve("users/alice/" + ReportSink.VERIFIED_REPORT));
        assertThat(report).isEqualTo("alice at 2025-08-06_10:00:03\n"
                + "Presence duration: 0.0 seconds\n"
                + "Dominant emotion: happy\n"
                + "Motion: 0.0\n"
                + "Max similarity: 85.0%\n\n");
        assertThat(ledger.size()).isEqualTo(4);
    }

    @Test
    void everyConfirmedFrameAppendsAnotherVerifiedBlock() throws Exception {
        registerWithFolder("alice");
        props.setActivationWindow(Duration.ZERO);

        service.processFrame(List.of(face(90, 100, 100)));
        service.processFrame(List.of(face(90, 100, 100)));
        clock.advance(Duration.ofSeconds(2));
        service.processFrame(List.of(face(90, 110, 100)));

        String report = Files.readString(tmp.resolve("users/alice/" + ReportSink.VERIFIED_REPORT));
        assertThat(report.split("\n\n")).hasSize(2);
        assertThat(report).contains("Presence duration: 2.0 seconds", "Motion: 10.0");
    }

    @Test
    void lowSimilarityIsLoggedAsUnknownIncident() throws Exception {
        registerWithFolder("alice");

        List<DetectionEvent> events = service.processFrame(List.of(face(45, 200, 200)));

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.identityLabel()).isEqualTo(DetectionEvent.UNKNOWN_LABEL);
            assertThat(e.known()).isFalse();
            assertThat(e.classification()).isEqualTo(MatchClass.UNKNOWN);
            assertThat(e.outcome()).isEqualTo(DetectionOutcome.UNKNOWN_INCIDENT);
            assertThat(e.similarity()).isEqualTo(45.0);
            assertThat(e.emotion()).isEqualTo(Emotion.HAPPY);
        });
        List<String> lines = Files.readAllLines(tmp.resolve("unknown/" + ReportSink.UNKNOWN_REPORT), StandardCharsets.UTF_8);
        assertThat(lines).containsExactly("unknown 20250806_100000 similarity:45.0% emotion:happy motion:0.0");
        try (Stream<Path> crops = Files.list(tmp.resolve("unknown/" + ReportSink.UNKNOWN_FACES_DIR))) {
            assertThat(crops).hasSize(1);
        }
        assertThat(tmp.resolve("users/alice/" + ReportSink.VERIFIED_REPORT)).doesNotExist();
        assertThat(sessions.find("alice")).isEmpty();
    }

    @Test
    void emptyStoreTreatsEveryFaceAsUnknown() {
        List<DetectionEvent> events = service.processFrame(List.of(face(99, 10, 10)));

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.similarity()).isZero();
            assertThat(e.outcome()).isEqualTo(DetectionOutcome.UNKNOWN_INCIDENT);
        });
    }

    @Test
    void greyZoneIsObservedOnlyAndClearsPendingCandidate() {
        registerWithFolder("alice");
        service.processFrame(List.of(face(85, 100, 100)));
        assertThat(service.sessionSnapshot("alice").phase()).isEqualTo(PresencePhase.PENDING);

        clock.advance(Duration.ofSeconds(1));
        List<DetectionEvent> events = service.processFrame(List.of(face(65, 100, 100)));

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.classification()).isEqualTo(MatchClass.GREY_ZONE);
            assertThat(e.outcome()).isEqualTo(DetectionOutcome.OBSERVED);
            assertThat(e.identityLabel()).isEqualTo(DetectionEvent.UNKNOWN_LABEL);
        });
        assertThat(service.sessionSnapshot("alice").phase()).isEqualTo(PresencePhase.IDLE);
        assertThat(tmp.resolve("unknown/" + ReportSink.UNKNOWN_REPORT)).doesNotExist();
    }

    @Test
    void unknownFacesShareOneMotionTrack() {
        service.processFrame(List.of(face(10, 100, 100)));
        List<DetectionEvent> events = service.processFrame(List.of(face(10, 106, 108)));

        assertThat(events.get(0).instantaneousMotion()).isEqualTo(10.0);
        assertThat(events.get(0).cumulativeMotion()).isEqualTo(10.0);
    }

    @Test
    void everyFaceOfAFrameYieldsOneEventWithTheFrameTimestamp() {
        registerWithFolder("alice");

        List<DetectionEvent> events = service.processFrame(List.of(face(85, 100, 100), face(30, 300, 300)));

        assertThat(events).extracting(DetectionEvent::identityLabel).containsExactly("alice", "unknown");
        assertThat(events).extracting(DetectionEvent::timestamp).containsOnly(T0);
        assertThat(ledger.size()).isEqualTo(2);
    }

    @Test
    void ledgerKeepsTheNewestEventsOnly() {
        store.register("alice", new double[]{1.0});
        for (int i = 0; i < 1001; i++) {
            clock.advance(Duration.ofMillis(10));
            service.processFrame(List.of(face(65, 100, 100)));
        }

        assertThat(ledger.size()).isEqualTo(1000);
        assertThat(ledger.snapshot().get(0).timestamp()).isEqualTo(T0.plusMillis(20));
    }

    @Test
    void convertsDetectorOutputAndUsesFrameJitters() {
        registerWithFolder("alice");
        DetectedFaceDto dto = new DetectedFaceDto();
        dto.setLocation(new BoundingBox(90, 110, 110, 90));
        dto.setEncoding(List.of(88.0));
        dto.setFaceImage(Base64.getEncoder().encodeToString(CROP));
        when(faceApi.detectFaces(any(), eq(FrameProcessingService.FRAME_JITTERS))).thenReturn(List.of(dto));

        List<DetectionEvent> events = service.processImage(Base64.getEncoder().encodeToString(new byte[]{9, 9}));

        verify(faceApi).detectFaces(any(), eq(5));
        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.identityLabel()).isEqualTo("alice");
            assertThat(e.location()).isEqualTo(new BoundingBox(90, 110, 110, 90));
        });
    }

    @Test
    void missingCropDefaultsToNeutral() {
        DetectedFaceDto dto = new DetectedFaceDto();
        dto.setLocation(new BoundingBox(0, 20, 20, 0));
        dto.setEncoding(List.of(65.0));

        assertThat(service.processDetections(List.of(dto)))
                .singleElement()
                .extracting(DetectionEvent::emotion)
                .isEqualTo(Emotion.NEUTRAL);
    }

    @Test
    void sessionSnapshotRequiresRegisteredIdentity() {
        assertThatThrownBy(() -> service.sessionSnapshot("ghost")).isInstanceOf(IdentityNotFoundException.class);

        store.register("bob", new double[]{1});
        assertThat(service.sessionSnapshot("bob").phase()).isEqualTo(PresencePhase.IDLE);
    }

    @Test
    void identityDeletedWhileItsFaceIsScoredLeavesNoSessionBehind() throws Exception {
        store.register("alice", new double[]{1.0});
        CountDownLatch scoring = new CountDownLatch(1);
        CountDownLatch deleted = new CountDownLatch(1);
        AtomicBoolean firstCall = new AtomicBoolean(true);
        MatchScorer blockingScorer = new MatchScorer(store, (observed, reference) -> {
            if (firstCall.getAndSet(false)) {
                scoring.countDown();
                awaitQuietly(deleted);
            }
            return observed[0];
        }, props);
        FrameProcessingService blocking = new FrameProcessingService(blockingScorer, tracker, sessions, ledger, sink,
                emotions, faceApi, store, props, clock);
        IdentityService identities = new IdentityService(store, faceApi, mock(IdentityFileRepository.class),
                sessions, tracker);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<List<DetectionEvent>> frame = executor.submit(
                    () -> blocking.processFrame(List.of(face(85, 100, 100))));
            assertThat(scoring.await(5, TimeUnit.SECONDS)).isTrue();
            identities.delete("alice");
            deleted.countDown();

            assertThat(frame.get(5, TimeUnit.SECONDS)).singleElement().satisfies(e -> {
                assertThat(e.identityLabel()).isEqualTo(DetectionEvent.UNKNOWN_LABEL);
                assertThat(e.known()).isFalse();
                assertThat(e.outcome()).isEqualTo(DetectionOutcome.UNKNOWN_INCIDENT);
            });
        } finally {
            executor.shutdownNow();
        }
        assertThat(sessions.find("alice")).isEmpty();
        assertThat(tracker.lastCenter("alice")).isNull();
        assertThat(tracker.lastCenter(MotionTracker.UNKNOWN_KEY)).isNotNull();
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void registerWithFolder(String name) {
        store.register(name, new double[]{1.0});
        try {
            Files.createDirectories(tmp.resolve("users").resolve(name));
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static ObservedFace face(double similarity, int cx, int cy) {
        return new ObservedFace(new BoundingBox(cy - 10, cx + 10, cy + 10, cx - 10), new double[]{similarity}, CROP);
    }
}
