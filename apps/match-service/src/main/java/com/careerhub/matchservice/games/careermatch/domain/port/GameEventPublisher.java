package com.careerhub.matchservice.games.careermatch.domain.port;

/**
 * 状态变更推送（外部订阅通道）。实现方必须吞掉推送失败，不能影响对局流程。
 */
public interface GameEventPublisher {

    /** 推给订阅该对局的客户端 */
    void publishToSession(String roomId, String sessionId, MatchEventType type, Object payload);

    /** 推给订阅该房间（大厅视角）的客户端 */
    void publishToRoom(String roomId, MatchEventType type, Object payload);

    enum MatchEventType {
        PARTICIPANT_JOINED,
        GAME_STARTED,
        CARD_UPDATED,
        MATCH_FOUND,
        NO_MATCH,
        TURN_CHANGED,
        GAME_COMPLETED,
        ROOM_INTERMISSION,
        ROOM_REOPENED,
        TICK,
        SNAPSHOT,
        ERROR
    }
}
