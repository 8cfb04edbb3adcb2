package com.incoresoft.presenceTracker.domain.history.service;

import com.incoresoft.presenceTracker.config.PresenceProps;
import com.incoresoft.presenceTracker.domain.history.dto.DetectionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes the retained history to XLSX, on demand or once a day.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryReportService {
    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss");

    private final PresenceProps props;
    private final HistoryLedger ledger;
    private final HistoryService historyService;
    private final HistoryExportService exportService;
    private final Clock clock;

    @Scheduled(cron = "${presence.export.schedule-cron:0 0 23 * * *}", zone = "${presence.export.timezone:UTC}")
    public void generateDaily() {
        if (!props.getExport().isEnabled()) return;
        try {
            buildExport();
        } catch (Exception ex) {
            log.error("History export failed: {}", ex.getMessage(), ex);
        }
    }

    public File buildExport() throws IOException {
        ZoneId zone = resolveZone();
        List<DetectionEvent> events = ledger.snapshot();
        File outputFile = prepareOutputFile(LocalDateTime.now(clock.withZone(zone)));
        File result = exportService.exportHistory(events, historyService.stats(), zone, outputFile);
        log.info("History export generated (tz={}): {}", zone, result.getAbsolutePath());
        return result;
    }

    private ZoneId resolveZone() {
        String cfg = props.getExport().getTimezone();
        if (!StringUtils.hasText(cfg)) return clock.getZone();
        try {
            return ZoneId.of(cfg.trim());
        } catch (Exception ex) {
            log.warn("Invalid tz '{}', falling back to system tz: {}", cfg, ex.getMessage());
            return clock.getZone();
        }
    }

    private File prepareOutputFile(LocalDateTime at) throws IOException {
        File outDir = new File(props.getExport().getOutputDir());
        Files.createDirectories(outDir.toPath());
        return new File(outDir, "history_" + FILE_TS.format(at) + ".xlsx");
    }
}
