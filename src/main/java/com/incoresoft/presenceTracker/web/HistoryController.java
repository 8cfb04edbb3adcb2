package com.incoresoft.presenceTracker.web;

import com.incoresoft.presenceTracker.domain.history.dto.HistoryPage;
import com.incoresoft.presenceTracker.domain.history.dto.HistoryStats;
import com.incoresoft.presenceTracker.domain.history.service.HistoryReportService;
import com.incoresoft.presenceTracker.domain.history.service.HistoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.File;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

@Slf4j
@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
public class HistoryController {
    private static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    private final HistoryService historyService;
    private final HistoryReportService reportService;

    /**
     * GET /api/history?limit=20&user=alice
     * Newest first; total counts every retained match of the filter.
     */
    @GetMapping
    public HistoryPage history(@RequestParam(name = "limit", required = false) Integer limit,
                               @RequestParam(name = "user", required = false) String user) {
        return historyService.query(limit, user);
    }

    @GetMapping("/stats")
    public HistoryStats stats() {
        return historyService.stats();
    }

    /** Retained history plus stats as XLSX. */
    @GetMapping("/export")
    public ResponseEntity<?> export() throws IOException {
        File file = reportService.buildExport();
        String cd = "attachment; filename=\"" + URLEncoder.encode(file.getName(), StandardCharsets.UTF_8) + "\"";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, cd)
                .header(HttpHeaders.CONTENT_TYPE, XLSX)
                .body(new FileSystemResource(file));
    }
}
