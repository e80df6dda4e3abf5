package com.careerhub.matchservice.games.careermatch.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "cmatch:";

    private RedisKeys() {}

    // ---- 房间 ----
    public static String room(String roomId) {
        return PFX + "room:" + roomId;
    }

    /** 房间目录（SET of roomId） */
    public static String roomIndex() {
        return PFX + "rooms:index";
    }

    // ---- 对局 ----
    public static String session(String sessionId) {
        return PFX + "session:" + sessionId;
    }

    /** Hash：participantId -> Participant */
    public static String sessionParticipants(String sessionId) {
        return PFX + "session:" + sessionId + ":participants";
    }

    /** Hash：userId -> participantId，用于幂等入座 */
    public static String sessionUsers(String sessionId) {
        return PFX + "session:" + sessionId + ":users";
    }

    /** Hash：position -> Card */
    public static String sessionCards(String sessionId) {
        return PFX + "session:" + sessionId + ":cards";
    }

    /** List：只追加的翻牌记录 */
    public static String sessionMoves(String sessionId) {
        return PFX + "session:" + sessionId + ":moves";
    }

    // ---- 锁 ----
    public static String lock(String name) {
        return PFX + "lock:" + name;
    }
}
