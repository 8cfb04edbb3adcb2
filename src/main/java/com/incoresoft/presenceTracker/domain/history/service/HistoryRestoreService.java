package com.incoresoft.presenceTracker.domain.history.service;

import com.incoresoft.presenceTracker.config.PresenceProps;
import com.incoresoft.presenceTracker.domain.history.dto.DetectionEvent;
import com.incoresoft.presenceTracker.domain.report.service.ReportFormat;
import com.incoresoft.presenceTracker.domain.report.service.ReportSink;
import com.incoresoft.presenceTracker.repository.IdentityFileRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the in-memory ledger from the report files left by previous runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryRestoreService {

    private final HistoryLedger ledger;
    private final IdentityFileRepository files;
    private final ReportSink reportSink;
    private final PresenceProps props;
    private final Clock clock;

    @PostConstruct
    public void init() {
        if (!props.getStorage().isRestoreHistory()) return;
        try {
            int restored = restore();
            log.info("Loaded {} detection records from report files", restored);
        } catch (Exception e) {
            log.warn("Exception was thrown while restoring detection history: {}", e.getMessage(), e);
        }
    }

    /**
     * Reads every verified report and the unknown report, orders them chronologically
     * and keeps the newest events that fit the ledger.
     *
     * @return number of events appended
     */
    public int restore() {
        List<DetectionEvent> restored = new ArrayList<>();
        for (Map.Entry<String, String> report : files.readVerifiedReports(ReportSink.VERIFIED_REPORT).entrySet()) {
            restored.addAll(ReportFormat.parseVerified(report.getValue(), report.getKey(), clock.getZone()));
        }
        Path unknownReport = reportSink.unknownDir().resolve(ReportSink.UNKNOWN_REPORT);
        if (Files.isRegularFile(unknownReport)) {
            try {
                for (String line : Files.readAllLines(unknownReport, StandardCharsets.UTF_8)) {
                    if (line.isBlank()) continue;
                    ReportFormat.parseUnknownLine(line, clock.getZone()).ifPresent(restored::add);
                }
            } catch (IOException e) {
                log.warn("Error reading unknown report {}: {}", unknownReport, e.getMessage());
            }
        }
        restored.sort(Comparator.comparing(DetectionEvent::timestamp));
        int from = Math.max(0, restored.size() - ledger.capacity());
        List<DetectionEvent> kept = restored.subList(from, restored.size());
        ledger.appendAll(kept);
        return kept.size();
    }
}
