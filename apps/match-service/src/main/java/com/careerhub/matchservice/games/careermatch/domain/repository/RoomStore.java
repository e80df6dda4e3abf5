package com.careerhub.matchservice.games.careermatch.domain.repository;

import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;

import java.util.List;
import java.util.Optional;

/**
 * 常驻房间仓储
 */
public interface RoomStore {

    void save(PerpetualRoom room);

    Optional<PerpetualRoom> find(String roomId);

    List<PerpetualRoom> findAll();

    long count();
}
