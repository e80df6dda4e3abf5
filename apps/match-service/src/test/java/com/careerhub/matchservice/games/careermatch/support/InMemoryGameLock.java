package com.careerhub.matchservice.games.careermatch.support;

import com.careerhub.matchservice.games.careermatch.domain.repository.GameLock;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 内存锁（忽略 TTL）
 */
public class InMemoryGameLock implements GameLock {

    private final Map<String, String> holders = new ConcurrentHashMap<>();

    @Override
    public boolean tryLock(String key, String token, Duration ttl) {
        return holders.putIfAbsent(key, token) == null;
    }

    @Override
    public void unlock(String key, String token) {
        holders.remove(key, token);
    }

    public boolean isLocked(String key) {
        return holders.containsKey(key);
    }
}
