package com.careerhub.matchservice.games.careermatch.domain.repository;

import com.careerhub.matchservice.games.careermatch.domain.model.Card;

import java.util.List;
import java.util.Optional;

/**
 * 卡牌仓储（对局独占其卡牌）
 */
public interface CardStore {

    void saveAll(String sessionId, List<Card> cards);

    void save(Card card);

    Optional<Card> find(String sessionId, int position);

    /** 按位置升序 */
    List<Card> findBySession(String sessionId);

    void deleteBySession(String sessionId);
}
