package com.careerhub.matchservice.games.careermatch.infrastructure.redis.repo;

import com.careerhub.matchservice.infrastructure.redis.RedisOps;
import com.careerhub.matchservice.games.careermatch.domain.model.Card;
import com.careerhub.matchservice.games.careermatch.domain.repository.CardStore;
import com.careerhub.matchservice.games.careermatch.infrastructure.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 卡牌的 Redis 仓储：Hash（position -> Card）。
 */
@Repository
@RequiredArgsConstructor
public class RedisCardStore implements CardStore {

    private static final Duration TTL = Duration.ofDays(7);

    private final RedisOps ops;

    @Override
    public void saveAll(String sessionId, List<Card> cards) {
        Map<String, Card> byPos = new LinkedHashMap<>();
        cards.forEach(c -> byPos.put(String.valueOf(c.getPosition()), c));
        String key = RedisKeys.sessionCards(sessionId);
        ops.hSetAll(key, byPos);
        ops.expire(key, TTL);
    }

    @Override
    public void save(Card card) {
        ops.hSet(RedisKeys.sessionCards(card.getSessionId()), String.valueOf(card.getPosition()), card);
    }

    @Override
    public Optional<Card> find(String sessionId, int position) {
        return Optional.ofNullable(ops.hGet(RedisKeys.sessionCards(sessionId), String.valueOf(position), Card.class));
    }

    @Override
    public List<Card> findBySession(String sessionId) {
        return ops.hGetAll(RedisKeys.sessionCards(sessionId)).values().stream()
                .map(Card.class::cast)
                .sorted(Comparator.comparingInt(Card::getPosition))
                .toList();
    }

    @Override
    public void deleteBySession(String sessionId) {
        ops.del(RedisKeys.sessionCards(sessionId));
    }
}
