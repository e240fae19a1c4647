package com.kspec.unit.client;

import static org.assertj.core.api.Assertions.assertThat;

import com.kspec.client.ClientScheduler;
import com.kspec.client.SingleThreadClientScheduler;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SingleThreadClientSchedulerTest {

    private final SingleThreadClientScheduler scheduler = new SingleThreadClientScheduler();

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    @DisplayName("tasks run on the dedicated client thread")
    void runsOnClientThread() throws InterruptedException {
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        scheduler.execute(() -> {
            threadName.set(Thread.currentThread().getName());
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(threadName.get()).isEqualTo("kspec-client");
    }

    @Test
    @DisplayName("a failing task does not stop later tasks")
    void failureDoesNotKillThread() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);

        scheduler.execute(() -> {
            throw new IllegalStateException("boom");
        });
        scheduler.execute(done::countDown);

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("cancelled delayed task never runs")
    void cancelledTaskSkipped() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean();
        ClientScheduler.Cancellable handle = scheduler.schedule(() -> ran.set(true), Duration.ofMillis(200));
        handle.cancel();

        CountDownLatch later = new CountDownLatch(1);
        scheduler.schedule(later::countDown, Duration.ofMillis(400));

        assertThat(later.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(ran).isFalse();
    }
}
