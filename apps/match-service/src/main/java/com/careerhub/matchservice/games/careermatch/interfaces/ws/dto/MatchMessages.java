package com.careerhub.matchservice.games.careermatch.interfaces.ws.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * WebSocket 消息体
 */
public class MatchMessages {

    /** 客户端 -> 服务端：翻牌 */
    @Data
    public static class FlipCmd {
        private String sessionId;
        private int position;
        /** 参与者ID 或用户ID */
        private String actorId;
    }

    /** 客户端 -> 服务端：请求全量快照 */
    @Data
    public static class SyncCmd {
        private String sessionId;
    }

    /** 服务端 -> 客户端：广播事件 */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BroadcastEvent {
        private String roomId;
        private String sessionId;
        /** CARD_UPDATED / MATCH_FOUND / TURN_CHANGED / TICK / ERROR ... */
        private String type;
        private Object payload;
        private long ts;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorPayload {
        private String errorCode;
        private String message;
    }
}
