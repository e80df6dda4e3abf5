package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.common.random.RandomSource;
import com.careerhub.matchservice.games.careermatch.domain.constants.CareerCatalog;
import com.careerhub.matchservice.games.careermatch.domain.model.Card;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 生成洗好的牌组：totalPairs 个职业各两张，位置 0..2n-1 不重复。
 */
@Component
@RequiredArgsConstructor
public class DeckFactory {

    /** 发牌动画错峰步长（毫秒） */
    static final int FLIP_DELAY_STEP_MS = 50;

    private final RandomSource random;

    public List<Card> build(String sessionId, int totalPairs) {
        if (totalPairs <= 0 || totalPairs > CareerCatalog.CAREERS.size()) {
            throw new IllegalArgumentException("totalPairs out of range: " + totalPairs);
        }
        List<String> careers = new ArrayList<>(CareerCatalog.CAREERS);
        random.shuffle(careers);

        List<Card> deck = new ArrayList<>(totalPairs * 2);
        for (int i = 0; i < totalPairs; i++) {
            String career = careers.get(i);
            String pairId = CareerCatalog.pairId(career, i + 1);
            deck.add(card(sessionId, career, pairId));
            deck.add(card(sessionId, career, pairId));
        }
        random.shuffle(deck);
        for (int pos = 0; pos < deck.size(); pos++) {
            deck.get(pos).setPosition(pos);
            deck.get(pos).setFlipDelayMs(pos * FLIP_DELAY_STEP_MS);
        }
        return deck;
    }

    private static Card card(String sessionId, String career, String pairId) {
        Card c = new Card();
        c.setSessionId(sessionId);
        c.setPairId(pairId);
        c.setCareerName(career);
        c.setCareerImagePath(CareerCatalog.imagePath(career));
        return c;
    }
}
