package com.incoresoft.presenceTracker.domain.history.service;

import com.incoresoft.presenceTracker.domain.history.dto.DetectionEvent;
import com.incoresoft.presenceTracker.domain.history.dto.HistoryStats;
import com.incoresoft.presenceTracker.domain.shared.dto.BoundingBox;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class HistoryExportService {
    public static final String HISTORY_SHEET = "History";
    public static final String STATS_SHEET = "Stats";
    private static final List<String> COLUMNS = List.of(
            "Timestamp", "User", "Similarity %", "Emotion", "Motion", "Total motion", "Known", "Outcome", "Location");
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Two sheets: History (one row per event, oldest first) and Stats (aggregate, then per-emotion counts).
     */
    public File exportHistory(List<DetectionEvent> events, HistoryStats stats, ZoneId zone, File outFile) {
        try (Workbook wb = new XSSFWorkbook()) {
            CellStyle headerStyle = wb.createCellStyle();
            Font headerFont = wb.createFont();
            headerFont.setBold(true);
            headerStyle.setFont(headerFont);

            Sheet sh = wb.createSheet(HISTORY_SHEET);
            int rowIndex = 0;
            Row header = sh.createRow(rowIndex++);
            for (int c = 0; c < COLUMNS.size(); c++) createCell(header, c, COLUMNS.get(c), headerStyle);

            for (DetectionEvent e : events) {
                Row row = sh.createRow(rowIndex++);
                createCell(row, 0, e.timestamp() == null ? "" : TS.format(e.timestamp().atZone(zone)), null);
                createCell(row, 1, e.identityLabel(), null);
                createNumericCell(row, 2, e.similarity(), null);
                createCell(row, 3, e.emotion() == null ? "" : e.emotion().label(), null);
                createNumericCell(row, 4, e.instantaneousMotion(), null);
                createNumericCell(row, 5, e.cumulativeMotion(), null);
                createCell(row, 6, e.known() ? "yes" : "no", null);
                createCell(row, 7, e.outcome() == null ? "" : e.outcome().wireName(), null);
                createCell(row, 8, formatLocation(e.location()), null);
            }
            sh.createFreezePane(0, 1);
            for (int c = 0; c < COLUMNS.size(); c++) sh.autoSizeColumn(c);

            writeStatsSheet(wb.createSheet(STATS_SHEET), stats, headerStyle);

            try (FileOutputStream fos = new FileOutputStream(outFile)) {
                wb.write(fos);
            }
            log.info("History written to excel: {} ({} events)", outFile.getAbsolutePath(), events.size());
        } catch (IOException e) {
            log.error("[EXPORT HISTORY]", e);
            throw new UncheckedIOException(e);
        }
        return outFile;
    }

    private static void writeStatsSheet(Sheet sh, HistoryStats stats, CellStyle headerStyle) {
        int r = 0;
        Row header = sh.createRow(r++);
        createCell(header, 0, "Metric", headerStyle);
        createCell(header, 1, "Value", headerStyle);
        r = metric(sh, r, "Registered users", stats.totalUsers());
        r = metric(sh, r, "Total detections", stats.totalDetections());
        r = metric(sh, r, "Known detections", stats.knownDetections());
        r = metric(sh, r, "Unknown detections", stats.unknownDetections());
        r = metric(sh, r, "Recent detections", stats.recentDetections());
        r = metric(sh, r, "Average motion", stats.averageMotion());
        for (Map.Entry<String, Integer> e : stats.emotionCounts().entrySet()) {
            r = metric(sh, r, "Emotion: " + e.getKey(), e.getValue());
        }
        sh.autoSizeColumn(0);
        sh.autoSizeColumn(1);
    }

    private static int metric(Sheet sh, int r, String name, double value) {
        Row row = sh.createRow(r);
        createCell(row, 0, name, null);
        createNumericCell(row, 1, value, null);
        return r + 1;
    }

    private static String formatLocation(BoundingBox box) {
        if (box == null) return "";
        return box.top() + "," + box.right() + "," + box.bottom() + "," + box.left();
    }

    private static void createCell(Row row, int col, String value, CellStyle style) {
        Cell cell = row.createCell(col, CellType.STRING);
        cell.setCellValue(value == null ? "" : value);
        if (style != null) cell.setCellStyle(style);
    }

    private static void createNumericCell(Row row, int col, double value, CellStyle style) {
        Cell cell = row.createCell(col, CellType.NUMERIC);
        cell.setCellValue(value);
        if (style != null) cell.setCellStyle(style);
    }
}
