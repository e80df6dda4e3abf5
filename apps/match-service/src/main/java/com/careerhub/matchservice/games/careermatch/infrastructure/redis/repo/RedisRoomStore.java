package com.careerhub.matchservice.games.careermatch.infrastructure.redis.repo;

import com.careerhub.matchservice.infrastructure.redis.RedisOps;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.domain.repository.RoomStore;
import com.careerhub.matchservice.games.careermatch.infrastructure.redis.RedisKeys;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 常驻房间的 Redis 仓储：房间 JSON 不设 TTL，并登记到房间目录。
 */
@Repository
@RequiredArgsConstructor
public class RedisRoomStore implements RoomStore {

    private final RedisOps ops;

    @Override
    public void save(PerpetualRoom room) {
        ops.set(RedisKeys.room(room.getId()), room);
        ops.sAdd(RedisKeys.roomIndex(), room.getId());
    }

    @Override
    public Optional<PerpetualRoom> find(String roomId) {
        return Optional.ofNullable(ops.get(RedisKeys.room(roomId), PerpetualRoom.class));
    }

    @Override
    public List<PerpetualRoom> findAll() {
        List<PerpetualRoom> out = new ArrayList<>();
        for (String id : ops.sMembers(RedisKeys.roomIndex())) {
            find(id).ifPresent(out::add);
        }
        return out;
    }

    @Override
    public long count() {
        return ops.sCard(RedisKeys.roomIndex());
    }
}
