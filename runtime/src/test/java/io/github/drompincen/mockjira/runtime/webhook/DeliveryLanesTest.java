package io.github.drompincen.mockjira.runtime.webhook;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryLanesTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void tasksOnOneLaneRunInSubmissionOrder() throws InterruptedException {
        DeliveryLanes lanes = new DeliveryLanes(executor, 1000);
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch done = new CountDownLatch(200);

        for (int i = 0; i < 200; i++) {
            int n = i;
            assertThat(lanes.submit("hook-1", () -> {
                seen.add(n);
                done.countDown();
            })).isTrue();
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            expected.add(i);
        }
        assertThat(seen).containsExactlyElementsOf(expected);
    }

    @Test
    void failingTaskDoesNotStallTheLane() throws InterruptedException {
        DeliveryLanes lanes = new DeliveryLanes(executor, 10);
        CountDownLatch done = new CountDownLatch(1);

        lanes.submit("hook-1", () -> {
            throw new IllegalStateException("boom");
        });
        lanes.submit("hook-1", done::countDown);

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void closedLanesRejectWork() {
        DeliveryLanes lanes = new DeliveryLanes(Runnable::run, 10);

        lanes.close();

        assertThat(lanes.submit("hook-1", () -> { })).isFalse();
    }
}
