package com.careerhub.matchservice.clock.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * CountdownSchedulerImpl
 * ---------------------------------------
 * 单节点内存倒计时：每秒一帧 tick，到期回调一次 timeout。
 * 回合状态本身在 Redis 中，计时只是驱动；重启后由下一次回合切换重新挂上。
 */
@Slf4j
public class CountdownSchedulerImpl implements CountdownScheduler {

    private final ScheduledThreadPoolExecutor scheduler;
    private final Clock clock;

    private volatile TickListener tickListener;

    // key -> 任务句柄
    private final ConcurrentMap<String, ScheduledFuture<?>> activeTasks = new ConcurrentHashMap<>();

    public CountdownSchedulerImpl(ScheduledThreadPoolExecutor scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public void setTickListener(TickListener listener) {
        this.tickListener = listener;
    }

    @Override
    public void startOrResume(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout) {
        // 防止重复任务：先取消老任务
        stop(key);
        if (deadlineEpochMs - clock.millis() <= 0) {
            safeTimeout(onTimeout, key, owner, version);
            return;
        }
        // 立即首帧 TICK
        fireTick(key, owner, deadlineEpochMs);
        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        self[0] = scheduler.scheduleAtFixedRate(() -> {
            if (deadlineEpochMs - clock.millis() <= 0) {
                // 只移除自己，避免误删同 key 的新任务
                activeTasks.remove(key, self[0]);
                self[0].cancel(false);
                safeTimeout(onTimeout, key, owner, version);
                return;
            }
            fireTick(key, owner, deadlineEpochMs);
        }, 1, 1, TimeUnit.SECONDS);
        activeTasks.put(key, self[0]);
    }

    @Override
    public void stop(String key) {
        ScheduledFuture<?> f = activeTasks.remove(key);
        if (f != null) {
            f.cancel(false);
        }
    }

    @Override
    public boolean isRunning(String key) {
        return activeTasks.containsKey(key);
    }

    private void fireTick(String key, String owner, long deadlineEpochMs) {
        TickListener l = tickListener;
        if (l == null) {
            return;
        }
        long left = Math.max(0, (deadlineEpochMs - clock.millis()) / 1000);
        try {
            l.onTick(key, owner, deadlineEpochMs, left);
        } catch (RuntimeException e) {
            log.warn("countdown tick listener failed: key={}", key, e);
        }
    }

    private void safeTimeout(TimeoutHandler onTimeout, String key, String owner, String version) {
        if (onTimeout == null) {
            return;
        }
        try {
            onTimeout.onTimeout(key, owner, version);
        } catch (RuntimeException e) {
            log.warn("countdown timeout handler failed: key={}, version={}", key, version, e);
        }
    }
}
