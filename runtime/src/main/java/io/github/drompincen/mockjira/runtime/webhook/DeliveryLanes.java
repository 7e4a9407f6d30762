package io.github.drompincen.mockjira.runtime.webhook;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs tasks on a shared executor while keeping tasks with the same lane key strictly serial.
 * At most {@code capacity} tasks may be pending across all lanes.
 */
public class DeliveryLanes {

    private static final Logger log = LoggerFactory.getLogger(DeliveryLanes.class);

    private final Executor executor;
    private final int capacity;
    private final Map<String, Lane> lanes = new HashMap<>();
    private int pending;
    private boolean closed;

    public DeliveryLanes(Executor executor, int capacity) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.capacity = Math.max(1, capacity);
    }

    /**
     * @return {@code false} if the task was not accepted because the lanes are full or closed
     */
    public boolean submit(String laneKey, Runnable task) {
        Lane lane;
        synchronized (this) {
            if (closed || pending >= capacity) {
                return false;
            }
            lane = lanes.computeIfAbsent(laneKey, Lane::new);
            lane.queue.addLast(task);
            pending++;
            if (lane.running) {
                return true;
            }
            lane.running = true;
        }
        try {
            executor.execute(() -> drain(lane));
        } catch (RejectedExecutionException e) {
            log.warn("Executor rejected delivery lane {}", laneKey, e);
            synchronized (this) {
                pending -= lane.queue.size();
                lane.queue.clear();
                lane.running = false;
                lanes.remove(laneKey);
            }
            return false;
        }
        return true;
    }

    public synchronized int pending() {
        return pending;
    }

    /**
     * Stops accepting work and drops every task that has not started yet.
     */
    public synchronized int close() {
        closed = true;
        int dropped = 0;
        for (Lane lane : lanes.values()) {
            dropped += lane.queue.size();
            lane.queue.clear();
        }
        pending -= dropped;
        return dropped;
    }

    private void drain(Lane lane) {
        while (true) {
            Runnable next;
            synchronized (this) {
                next = lane.queue.pollFirst();
                if (next == null) {
                    lane.running = false;
                    lanes.remove(lane.key);
                    return;
                }
            }
            try {
                next.run();
            } catch (RuntimeException e) {
                log.warn("Delivery task on lane {} failed", lane.key, e);
            } finally {
                synchronized (this) {
                    pending--;
                }
            }
        }
    }

    private static final class Lane {
        private final String key;
        private final ArrayDeque<Runnable> queue = new ArrayDeque<>();
        private boolean running;

        private Lane(String key) {
            this.key = key;
        }
    }
}
