package com.careerhub.matchservice.games.careermatch.application;

import com.careerhub.matchservice.games.careermatch.config.CareerMatchProperties;
import com.careerhub.matchservice.games.careermatch.config.CareerMatchProperties.RoomSeed;
import com.careerhub.matchservice.games.careermatch.domain.enums.RoomStatus;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.domain.repository.RoomStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * 启动时初始化常驻房间目录（目录非空则跳过）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomSeeder {

    private final RoomStore rooms;
    private final CareerMatchProperties props;
    private final Clock clock;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        seedIfEmpty();
    }

    /**
     * @return 新建的房间数
     */
    public int seedIfEmpty() {
        if (!props.getSeed().isEnabled()) {
            return 0;
        }
        if (rooms.count() > 0) {
            return 0;
        }
        int created = 0;
        for (RoomSeed seed : props.getSeed().getRooms()) {
            rooms.save(toRoom(seed));
            created++;
        }
        if (created == 0) {
            log.warn("房间种子为空，加入游戏将返回 NO_ROOMS_AVAILABLE");
        } else {
            log.info("已初始化常驻房间 {} 个", created);
        }
        return created;
    }

    PerpetualRoom toRoom(RoomSeed seed) {
        if (seed.getGridRows() * seed.getGridCols() != seed.getTotalPairs() * 2) {
            throw new IllegalArgumentException("grid " + seed.getGridRows() + "x" + seed.getGridCols()
                    + " does not fit " + seed.getTotalPairs() + " pairs in room " + seed.getCode());
        }
        long now = clock.millis();
        PerpetualRoom r = new PerpetualRoom();
        r.setId(UUID.randomUUID().toString());
        r.setRoomCode(seed.getCode());
        r.setRoomName(seed.getName());
        r.setDifficulty(seed.getDifficulty());
        r.setStatus(RoomStatus.ACTIVE);
        r.setIntermissionDurationSeconds(seed.getIntermissionSeconds() > 0
                ? seed.getIntermissionSeconds() : props.getIntermission().getSeconds());
        r.setMaxPlayersPerGame(seed.getMaxPlayers());
        r.setTotalPairs(seed.getTotalPairs());
        r.setGridRows(seed.getGridRows());
        r.setGridCols(seed.getGridCols());
        r.setTurnTimeLimitSeconds(seed.getTurnTimeLimitSeconds());
        r.setAiFillEnabled(seed.isAiFillEnabled());
        r.setAiFillPolicy(seed.getAiFillPolicy());
        r.setEnabled(true);
        r.setFeatured(seed.isFeatured());
        r.setCreatedAt(now);
        r.setUpdatedAt(now);
        return r;
    }
}
