package com.careerhub.matchservice.clock.scheduler;

/**
 * CountdownScheduler
 * ---------------------------------------
 * 通用倒计时调度器，不关心具体业务。
 *  - 每秒 tick 回调（用于前端倒计时展示）；
 *  - 到期 timeout 回调（由上层决定是否做权威处理）。
 */
public interface CountdownScheduler {

    interface TickListener {
        /**
         * @param key              业务键（如 "match:{sessionId}"）
         * @param owner            当前被计时的一方
         * @param deadlineEpochMs  绝对截止时间（毫秒）
         * @param remainingSeconds 剩余秒数
         */
        void onTick(String key, String owner, long deadlineEpochMs, long remainingSeconds);
    }

    interface TimeoutHandler {
        /**
         * @param version 上层自定义的回合版本，用于丢弃过期计时
         */
        void onTimeout(String key, String owner, String version);
    }

    void setTickListener(TickListener listener);

    /**
     * 启动或替换指定 key 的倒计时；已到期则直接回调 timeout。
     */
    void startOrResume(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout);

    void stop(String key);

    /** 当前是否有该 key 的计时任务 */
    boolean isRunning(String key);
}
