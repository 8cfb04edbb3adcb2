package com.incoresoft.presenceTracker.domain.history.service;

import com.incoresoft.presenceTracker.config.PresenceProps;
import com.incoresoft.presenceTracker.domain.history.dto.DetectionEvent;
import com.incoresoft.presenceTracker.domain.report.service.ReportSink;
import com.incoresoft.presenceTracker.repository.IdentityFileRepository;
import com.incoresoft.presenceTracker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class HistoryRestoreServiceTest {

    @TempDir
    Path tmp;

    private final PresenceProps props = new PresenceProps();
    private final MutableClock clock = new MutableClock(Instant.parse("2025-08-07T00:00:00Z"));
    private IdentityFileRepository files;
    private ReportSink sink;

    @BeforeEach
    void setUp() throws Exception {
        props.getStorage().setUsersDir(tmp.resolve("users").toString());
        props.getStorage().setUnknownDir(tmp.resolve("unknown").toString());
        files = new IdentityFileRepository(props);
        sink = new ReportSink(files, props, clock);

        Files.createDirectories(tmp.resolve("users/alice"));
        Files.writeString(tmp.resolve("users/alice/" + ReportSink.VERIFIED_REPORT),
                "alice at 2025-08-06_10:00:05\nPresence duration: 1.0 seconds\nDominant emotion: happy\n"
                        + "Motion: 3.0\nMax similarity: 88.0%\n\n"
                        + "alice at 2025-08-06_10:00:01\nPresence duration: 0.0 seconds\nDominant emotion: sad\n"
                        + "Motion: 0.0\nMax similarity: 80.0%\n\n");
        Files.createDirectories(tmp.resolve("unknown"));
        Files.writeString(tmp.resolve("unknown/" + ReportSink.UNKNOWN_REPORT),
                "unknown 20250806_100003 similarity:40.0% emotion:angry motion:7.0\n"
                        + "\n"
                        + "not a report line\n");
    }

    @Test
    void restoresEventsInChronologicalOrder() {
        HistoryLedger ledger = new HistoryLedger(10);
        HistoryRestoreService service = new HistoryRestoreService(ledger, files, sink, props, clock);

        assertThat(service.restore()).isEqualTo(3);
        assertThat(ledger.snapshot()).extracting(DetectionEvent::timestamp).containsExactly(
                Instant.parse("2025-08-06T10:00:01Z"),
                Instant.parse("2025-08-06T10:00:03Z"),
                Instant.parse("2025-08-06T10:00:05Z"));
        assertThat(ledger.snapshot()).extracting(DetectionEvent::identityLabel)
                .containsExactly("alice", "unknown", "alice");
    }

    @Test
    void keepsOnlyNewestEventsThatFit() {
        HistoryLedger ledger = new HistoryLedger(2);
        HistoryRestoreService service = new HistoryRestoreService(ledger, files, sink, props, clock);

        assertThat(service.restore()).isEqualTo(2);
        assertThat(ledger.snapshot().get(0).identityLabel()).isEqualTo("unknown");
    }

    @Test
    void disabledRestoreLeavesLedgerEmpty() {
        props.getStorage().setRestoreHistory(false);
        HistoryLedger ledger = new HistoryLedger(10);

        new HistoryRestoreService(ledger, files, sink, props, clock).init();

        assertThat(ledger.size()).isZero();
    }

    @Test
    void missingFoldersRestoreNothing() {
        props.getStorage().setUsersDir(tmp.resolve("nope").toString());
        props.getStorage().setUnknownDir(tmp.resolve("nope2").toString());
        HistoryLedger ledger = new HistoryLedger(10);

        assertThat(new HistoryRestoreService(ledger, files, sink, props, clock).restore()).isZero();
    }
}
