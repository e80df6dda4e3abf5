package com.careerhub.matchservice.games.careermatch.domain.constants;

/**
 * 职业翻牌游戏相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 房间 / 对局 ==========

    /** 房间目录为空（缺少种子数据） */
    public static final String NO_ROOMS_AVAILABLE = "暂无可用房间，请联系管理员初始化房间配置";

    public static final String ROOM_NOT_FOUND = "房间不存在：%s";

    public static final String SESSION_NOT_FOUND = "对局不存在：%s";

    /** 对局已结束或未激活 */
    public static final String SESSION_NOT_ACTIVE = "对局未在进行中";

    public static final String SESSION_FULL = "本局人数已满，请等待下一局";

    /** 开局时没有任何参与者（调用方违约） */
    public static final String EMPTY_ROOM = "对局中没有参与者，无法开局";

    public static final String ROOM_BUSY = "房间正忙，请稍后重试";

    public static final String DEFAULT_DISPLAY_NAME = "Player";

    // ========== 回合 / 翻牌 ==========

    public static final String NOT_YOUR_TURN = "还没轮到你（当前回合：%s）";

    public static final String CARD_NOT_FOUND = "卡牌不存在：位置 %d";

    public static final String CARD_ALREADY_MATCHED = "该卡牌已被配对";

    public static final String CARD_ALREADY_REVEALED = "该卡牌已翻开";

    /** 并发冲突：同一对局有其它请求正在处理 */
    public static final String TURN_CONFLICT = "操作冲突，请刷新对局状态后重试";

    public static String formatRoomNotFound(String roomId) {
        return String.format(ROOM_NOT_FOUND, roomId);
    }

    public static String formatSessionNotFound(String sessionId) {
        return String.format(SESSION_NOT_FOUND, sessionId);
    }

    public static String formatNotYourTurn(String currentPlayer) {
        return String.format(NOT_YOUR_TURN, currentPlayer == null ? "未开始" : currentPlayer);
    }

    public static String formatCardNotFound(int position) {
        return String.format(CARD_NOT_FOUND, position);
    }
}
