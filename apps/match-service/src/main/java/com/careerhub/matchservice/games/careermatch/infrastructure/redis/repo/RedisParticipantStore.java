package com.careerhub.matchservice.games.careermatch.infrastructure.redis.repo;

import com.careerhub.matchservice.infrastructure.redis.RedisOps;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.repository.ParticipantStore;
import com.careerhub.matchservice.games.careermatch.infrastructure.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 参与者的 Redis 仓储：Hash（participantId -> Participant）+ userId 索引。
 */
@Repository
@RequiredArgsConstructor
public class RedisParticipantStore implements ParticipantStore {

    private static final Duration TTL = Duration.ofDays(7);

    private final RedisOps ops;

    @Override
    public void save(Participant p) {
        String key = RedisKeys.sessionParticipants(p.getSessionId());
        ops.hSet(key, p.getId(), p);
        ops.expire(key, TTL);
        if (p.getUserId() != null) {
            String users = RedisKeys.sessionUsers(p.getSessionId());
            ops.hSet(users, p.getUserId(), p.getId());
            ops.expire(users, TTL);
        }
    }

    @Override
    public Optional<Participant> find(String sessionId, String participantId) {
        return Optional.ofNullable(ops.hGet(RedisKeys.sessionParticipants(sessionId), participantId, Participant.class));
    }

    @Override
    public Optional<Participant> findByUser(String sessionId, String userId) {
        String participantId = ops.hGet(RedisKeys.sessionUsers(sessionId), userId, String.class);
        return participantId == null ? Optional.empty() : find(sessionId, participantId);
    }

    @Override
    public List<Participant> findBySession(String sessionId) {
        List<Participant> out = new ArrayList<>();
        ops.hGetAll(RedisKeys.sessionParticipants(sessionId)).values().forEach(v -> out.add((Participant) v));
        return out;
    }
}
