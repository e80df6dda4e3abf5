package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.games.careermatch.domain.constants.GameMessages;
import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.exception.CareerMatchException;
import com.careerhub.matchservice.games.careermatch.domain.exception.ErrorCode;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;
import com.careerhub.matchservice.games.careermatch.domain.repository.RoomStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * 房间分配：在可用且推荐的房间中按难度筛选，优先人数最少、仍有空位的房间。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomAllocator {

    private static final Comparator<PerpetualRoom> LEAST_OCCUPIED =
            Comparator.comparingInt(PerpetualRoom::getCurrentPlayerCount)
                    .thenComparing(PerpetualRoom::getRoomCode, Comparator.nullsLast(Comparator.naturalOrder()));

    private final RoomStore rooms;

    /**
     * @param difficulty 期望难度，null 表示不限
     * @throws CareerMatchException NO_ROOMS_AVAILABLE 房间目录为空（缺少种子数据）
     */
    public PerpetualRoom findAvailableRoom(Difficulty difficulty) {
        List<PerpetualRoom> catalog = rooms.findAll();
        if (catalog.isEmpty()) {
            log.error("房间目录为空，无法分配房间");
            throw CareerMatchException.of(ErrorCode.NO_ROOMS_AVAILABLE, GameMessages.NO_ROOMS_AVAILABLE);
        }

        List<PerpetualRoom> candidates = catalog.stream()
                .filter(PerpetualRoom::isEnabled)
                .filter(PerpetualRoom::isFeatured)
                .filter(r -> difficulty == null || r.getDifficulty() == difficulty)
                .sorted(LEAST_OCCUPIED)
                .toList();
        if (!candidates.isEmpty()) {
            return candidates.stream().filter(PerpetualRoom::hasSpace).findFirst().orElse(candidates.get(0));
        }

        // 没有匹配难度的推荐房间：退回任意可用房间
        PerpetualRoom fallback = catalog.stream()
                .filter(PerpetualRoom::isEnabled)
                .min(LEAST_OCCUPIED)
                .orElseThrow(() -> CareerMatchException.of(ErrorCode.NO_ROOMS_AVAILABLE, GameMessages.NO_ROOMS_AVAILABLE));
        log.warn("没有匹配难度 {} 的推荐房间，退回房间 {}", difficulty, fallback.getRoomCode());
        return fallback;
    }

    /**
     * 大厅房间列表（按房间编码排序）
     */
    public List<PerpetualRoom> listRooms() {
        return rooms.findAll().stream()
                .sorted(Comparator.comparing(PerpetualRoom::getRoomCode, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }
}
