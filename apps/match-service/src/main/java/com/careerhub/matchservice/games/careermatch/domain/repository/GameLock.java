package com.careerhub.matchservice.games.careermatch.domain.repository;

import java.time.Duration;

/**
 * 互斥锁（带持有者令牌）。只有持有者才能释放，过期自动失效。
 */
public interface GameLock {

    /**
     * @return true 表示加锁成功
     */
    boolean tryLock(String key, String token, Duration ttl);

    /**
     * 仅当锁仍由 token 持有时释放。
     */
    void unlock(String key, String token);
}
