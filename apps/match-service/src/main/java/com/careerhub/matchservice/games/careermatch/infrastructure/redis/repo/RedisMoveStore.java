package com.careerhub.matchservice.games.careermatch.infrastructure.redis.repo;

import com.careerhub.matchservice.infrastructure.redis.RedisOps;
import com.careerhub.matchservice.games.careermatch.domain.model.Move;
import com.careerhub.matchservice.games.careermatch.domain.repository.MoveStore;
import com.careerhub.matchservice.games.careermatch.infrastructure.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;

/**
 * 翻牌记录的 Redis 仓储：List 只做 RPUSH。
 */
@Repository
@RequiredArgsConstructor
public class RedisMoveStore implements MoveStore {

    private static final Duration TTL = Duration.ofDays(7);

    private final RedisOps ops;

    @Override
    public void append(Move move) {
        String key = RedisKeys.sessionMoves(move.getSessionId());
        ops.rPush(key, move);
        ops.expire(key, TTL);
    }

    @Override
    public List<Move> findBySession(String sessionId) {
        return ops.lRangeAll(RedisKeys.sessionMoves(sessionId), Move.class);
    }
}
