package com.incoresoft.presenceTracker.domain.history.service;

import com.incoresoft.presenceTracker.config.PresenceProps;
import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;
import com.incoresoft.presenceTracker.domain.history.dto.DetectionEvent;
import com.incoresoft.presenceTracker.domain.history.dto.HistoryPage;
import com.incoresoft.presenceTracker.domain.history.dto.HistoryStats;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded, insertion-ordered log of detection events. Oldest entries are evicted first.
 */
@Component
public class HistoryLedger {

    private final int capacity;
    private final Deque<DetectionEvent> events = new ArrayDeque<>();

    @Autowired
    public HistoryLedger(PresenceProps props) {
        this(props.getHistoryCapacity());
    }

    public HistoryLedger(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("History capacity must be positive");
        this.capacity = capacity;
    }

    public synchronized void append(DetectionEvent event) {
        events.addLast(event);
        while (events.size() > capacity) events.removeFirst();
    }

    public synchronized void appendAll(Collection<DetectionEvent> batch) {
        for (DetectionEvent e : batch) append(e);
    }

    /**
     * @param limit          maximum number of events returned, must be positive
     * @param identityFilter exact label to keep; blank keeps everything
     */
    public synchronized HistoryPage query(int limit, String identityFilter) {
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
        boolean filter = StringUtils.hasText(identityFilter);
        List<DetectionEvent> page = new ArrayList<>(Math.min(limit, events.size()));
        int total = 0;
        for (Iterator<DetectionEvent> it = events.descendingIterator(); it.hasNext(); ) {
            DetectionEvent e = it.next();
            if (filter && !identityFilter.equals(e.identityLabel())) continue;
            total++;
            if (page.size() < limit) page.add(e);
        }
        return new HistoryPage(page, total);
    }

    /**
     * O(n) aggregate over the retained window.
     *
     * @param recentSince events strictly after this instant count as recent
     */
    public synchronized HistoryStats stats(int totalUsers, Instant recentSince) {
        Map<String, Integer> emotionCounts = new LinkedHashMap<>();
        for (Emotion e : Emotion.values()) emotionCounts.put(e.label(), 0);

        int known = 0;
        int recent = 0;
        double motion = 0;
        for (DetectionEvent e : events) {
            if (e.known()) known++;
            if (e.timestamp() != null && e.timestamp().isAfter(recentSince)) recent++;
            if (e.emotion() != null) emotionCounts.merge(e.emotion().label(), 1, Integer::sum);
            motion += e.instantaneousMotion();
        }
        int total = events.size();
        double avg = total == 0 ? 0 : Math.round(motion / total * 10.0) / 10.0;
        return new HistoryStats(totalUsers, total, known, total - known, recent, avg, emotionCounts);
    }

    /** Chronological copy of the retained window. */
    public synchronized List<DetectionEvent> snapshot() {
        return new ArrayList<>(events);
    }

    public synchronized int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }
}
