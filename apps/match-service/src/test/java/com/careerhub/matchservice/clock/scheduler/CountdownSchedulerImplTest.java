package com.careerhub.matchservice.clock.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

class CountdownSchedulerImplTest {

    private final ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1);
    private final Clock clock = Clock.systemUTC();
    private final CountdownSchedulerImpl scheduler = new CountdownSchedulerImpl(executor, clock);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("截止时间已过时立即回调超时")
    void startOrResume_pastDeadlineTimesOutImmediately() {
        List<String> fired = new CopyOnWriteArrayList<>();

        scheduler.startOrResume("match:r1:s1", "p1", clock.millis() - 1, "s1:3",
                (key, owner, version) -> fired.add(version));

        assertThat(fired).containsExactly("s1:3");
        assertThat(scheduler.isRunning("match:r1:s1")).isFalse();
    }

    @Test
    @DisplayName("启动时立即推送首帧 tick，stop 后不再运行")
    void startOrResume_firstTickThenStop() {
        List<Long> ticks = new CopyOnWriteArrayList<>();
        scheduler.setTickListener((key, owner, deadline, left) -> ticks.add(left));

        scheduler.startOrResume("match:r1:s1", "p1", clock.millis() + 30_000, "s1:1", null);

        assertThat(ticks).hasSize(1);
        assertThat(ticks.get(0)).isBetween(28L, 30L);
        assertThat(scheduler.isRunning("match:r1:s1")).isTrue();

        scheduler.stop("match:r1:s1");
        assertThat(scheduler.isRunning("match:r1:s1")).isFalse();
    }

    @Test
    @DisplayName("tick 监听抛异常不影响计时")
    void tickListenerFailure_isContained() {
        scheduler.setTickListener((key, owner, deadline, left) -> {
            throw new IllegalStateException("boom");
        });

        scheduler.startOrResume("match:r1:s1", "p1", clock.millis() + 30_000, "s1:1", null);

        assertThat(scheduler.isRunning("match:r1:s1")).isTrue();
    }
}
