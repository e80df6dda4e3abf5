package com.careerhub.matchservice.games.careermatch.domain.repository;

import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;

import java.util.Optional;

/**
 * 对局仓储
 */
public interface SessionStore {

    /**
     * 新建对局时写入（不做版本校验）。
     */
    void save(GameSession session);

    Optional<GameSession> find(String sessionId);

    /**
     * 乐观并发保存：仅当存储中的 version 等于 session.getVersion() 时写入，
     * 成功后 session.version 自增。
     * @return false 表示版本已被其它请求修改
     */
    boolean compareAndSave(GameSession session);
}
