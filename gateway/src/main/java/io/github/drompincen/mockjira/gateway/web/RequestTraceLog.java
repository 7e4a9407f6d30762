package io.github.drompincen.mockjira.gateway.web;

import io.github.drompincen.mockjira.protocol.api.TraceEntry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded ring buffer of recent requests; the oldest entry is evicted once {@code capacity} is reached.
 */
@Component
public class RequestTraceLog {

    private final int capacity;
    private final Deque<TraceEntry> entries = new ArrayDeque<>();

    public RequestTraceLog(@Value("${mockjira.trace.capacity:500}") int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public synchronized void record(TraceEntry entry) {
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
    }

    public synchronized List<TraceEntry> find(String requestId) {
        return entries.stream().filter(e -> e.requestId().equals(requestId)).toList();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
