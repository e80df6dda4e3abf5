package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.games.careermatch.domain.dto.FlipResult;
import com.careerhub.matchservice.games.careermatch.domain.dto.GameStateView;
import com.careerhub.matchservice.games.careermatch.domain.dto.JoinResult;
import com.careerhub.matchservice.games.careermatch.domain.enums.ConnectionStatus;
import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.model.GameSession;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import com.careerhub.matchservice.games.careermatch.domain.model.PerpetualRoom;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 职业翻牌游戏对外服务（HTTP / WebSocket 入口共用）。
 */
public interface CareerMatchService {

    /**
     * 加入游戏：分配房间 → 获取 / 创建对局 → 入座；满员自动开局，否则启动 AI 补位计时。
     * @param displayName 可空，默认 "Player"
     * @param difficulty  可空，表示不限难度
     */
    JoinResult joinGame(String userId, String displayName, Difficulty difficulty);

    /**
     * 翻牌。第二翻的 future 在揭示结束后完成。
     */
    CompletableFuture<FlipResult> flipCard(String sessionId, int position, String actorId);

    GameStateView getGameState(String sessionId);

    /**
     * 管理触发开局（通常由满员或补位计时自动触发）。
     */
    GameSession startGameSession(String sessionId);

    /** 上报连接状态（不影响回合） */
    Participant reportConnection(String sessionId, String userId, ConnectionStatus status);

    List<PerpetualRoom> listRooms();
}
