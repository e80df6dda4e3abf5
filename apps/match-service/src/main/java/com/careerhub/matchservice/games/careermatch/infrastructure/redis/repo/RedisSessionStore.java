package com.careerhub.matchservice.games.careermatch.infrastructure.redis.repo;

import com.careerhub.matchservice.infrastructure.redis.RedisOps;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.repository.SessionStore;
import com.careerhub.matchservice.games.careermatch.infrastructure.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 对局的 Redis 仓储。
 * 对局结束后仍保留一段时间，便于结算查询与回放。
 */
@Repository
@RequiredArgsConstructor
public class RedisSessionStore implements SessionStore {

    static final Duration SESSION_TTL = Duration.ofDays(7);

    private final RedisOps ops;

    private final RedisTemplate<String, Object> redisTemplate;

    @Override
    public void save(GameSession session) {
        ops.setEx(RedisKeys.session(session.getId()), session, SESSION_TTL);
    }

    @Override
    public Optional<GameSession> find(String sessionId) {
        return Optional.ofNullable(ops.get(RedisKeys.session(sessionId), GameSession.class));
    }

    /**
     * WATCH 对局键，校验版本后在 MULTI/EXEC 中写入新版本。
     * 提交前键被其它请求修改时 EXEC 返回 null，视为失败。
     */
    @Override
    public boolean compareAndSave(GameSession session) {
        final String key = RedisKeys.session(session.getId());
        final long expected = session.getVersion();

        Boolean ok = redisTemplate.execute(new SessionCallback<Boolean>() {
            @SuppressWarnings("unchecked")
            @Override
            public <K, V> Boolean execute(RedisOperations<K, V> operations) throws DataAccessException {
                operations.watch((K) key);
                GameSession cur = (GameSession) operations.opsForValue().get((K) key);
                if (cur == null || cur.getVersion() != expected) {
                    operations.unwatch();
                    return false;
                }
                session.setVersion(expected + 1);
                operations.multi();
                operations.opsForValue().set((K) key, (V) session, SESSION_TTL);
                List<Object> res = operations.exec();
                return res != null && !res.isEmpty();
            }
        });

        if (!Boolean.TRUE.equals(ok)) {
            session.setVersion(expected);
            return false;
        }
        return true;
    }
}
