package com.careerhub.matchservice.games.careermatch.domain.repository;

import com.careerhub.matchservice.games.careermatch.domain.model.Participant;

import java.util.List;
import java.util.Optional;

/**
 * 参与者仓储（对局独占其参与者）
 */
public interface ParticipantStore {

    void save(Participant participant);

    Optional<Participant> find(String sessionId, String participantId);

    /**
     * 按真人 userId 查找（用于幂等入座）
     */
    Optional<Participant> findByUser(String sessionId, String userId);

    /** 顺序不保证，调用方自行排序 */
    List<Participant> findBySession(String sessionId);
}
