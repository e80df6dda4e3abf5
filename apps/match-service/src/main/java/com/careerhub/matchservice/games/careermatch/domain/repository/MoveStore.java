package com.careerhub.matchservice.games.careermatch.domain.repository;

import com.careerhub.matchservice.games.careermatch.domain.model.Move;

import java.util.List;

/**
 * 翻牌记录仓储：只追加
 */
public interface MoveStore {

    void append(Move move);

    /** 按追加顺序 */
    List<Move> findBySession(String sessionId);
}
