package com.careerhub.matchservice.games.careermatch.infrastructure.redis.repo;

import com.careerhub.matchservice.infrastructure.redis.RedisOps;
import com.careerhub.matchservice.games.careermatch.domain.repository.GameLock;
import com.careerhub.matchservice.games.careermatch.infrastructure.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;

/**
 * 基于 SET NX PX 的互斥锁；释放时 Lua 比对令牌后删除，防止误删他人的锁。
 */
@Repository
@RequiredArgsConstructor
public class RedisGameLock implements GameLock {

    private static final String UNLOCK_LUA =
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end";

    private final RedisOps ops;

    @Override
    public boolean tryLock(String key, String token, Duration ttl) {
        return ops.setStringNx(RedisKeys.lock(key), token, ttl);
    }

    @Override
    public void unlock(String key, String token) {
        ops.evalString(UNLOCK_LUA, List.of(RedisKeys.lock(key)), List.of(token), Long.class);
    }
}
