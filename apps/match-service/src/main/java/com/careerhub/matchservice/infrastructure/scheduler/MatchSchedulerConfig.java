package com.careerhub.matchservice.infrastructure.scheduler;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 本服务的全部后台线程池，三者互不共用线程：
 * <ul>
 *   <li>turnClockScheduler：回合倒计时 tick，队列满时丢弃 tick；</li>
 *   <li>matchScheduler：翻牌揭示续作、AI 补位计时、局间休息计时；</li>
 *   <li>xpLedgerExecutor：对局结果推送 XP 账本（远程调用，可能很慢）。</li>
 * </ul>
 * 线程均为守护线程。
 */
@Configuration
public class MatchSchedulerConfig {

    @Value("${scheduler.clock.corePoolSize:2}")
    private int clockPoolSize;

    @Value("${scheduler.match.corePoolSize:0}")
    private int matchPoolSize;

    @Value("${scheduler.xp-ledger.poolSize:2}")
    private int ledgerPoolSize;

    @Value("${scheduler.xp-ledger.queueCapacity:200}")
    private int ledgerQueueCapacity;

    @Bean(name = "turnClockScheduler", destroyMethod = "shutdown")
    public ScheduledThreadPoolExecutor turnClockScheduler() {
        ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(clockPoolSize,
                daemonThreads("countdown-"), new ThreadPoolExecutor.DiscardPolicy());
        exec.setRemoveOnCancelPolicy(true);
        return exec;
    }

    @Bean(name = "matchScheduler", destroyMethod = "shutdown")
    public ScheduledExecutorService matchScheduler() {
        int poolSize = matchPoolSize > 0 ? matchPoolSize : Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
        ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(poolSize, daemonThreads("match-reveal-"));
        exec.setRemoveOnCancelPolicy(true);
        return exec;
    }

    /**
     * 有界队列；积压满时由提交方抛 RejectedExecutionException，结算方只记日志。
     */
    @Bean(name = "xpLedgerExecutor", destroyMethod = "shutdown")
    public ExecutorService xpLedgerExecutor() {
        return new ThreadPoolExecutor(ledgerPoolSize, ledgerPoolSize, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(ledgerQueueCapacity), daemonThreads("xp-ledger-"),
                new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
