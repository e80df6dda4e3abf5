package com.careerhub.matchservice.games.careermatch.domain.model;

import com.careerhub.matchservice.games.careermatch.domain.enums.AiFillPolicy;
import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.enums.RoomStatus;
import lombok.Data;

/**
 * 常驻房间：由种子配置创建一次，之后在 ACTIVE 与 INTERMISSION 之间循环，承载一局又一局。
 * 时间字段统一使用 epoch 毫秒，便于 JSON 存储。
 */
@Data
public class PerpetualRoom {
    private String id;
    /** 房间编码，如 MATCH01 */
    private String roomCode;
    private String roomName;
    private Difficulty difficulty;
    private RoomStatus status;

    /** 已开过的局数（新局编号 = currentGameNumber + 1） */
    private int currentGameNumber;
    /** 当前局的弱引用，房间不拥有对局的生命周期 */
    private String currentGameId;
    /** 局间休息结束时间；非休息期为 null */
    private Long nextGameStartsAt;
    private int intermissionDurationSeconds;

    private int maxPlayersPerGame;
    private int currentPlayerCount;

    private int totalPairs;
    private int gridRows;
    private int gridCols;
    /** 单回合时限（秒），是否强制由 career-match.turn.timeout-mode 决定 */
    private int turnTimeLimitSeconds;

    private boolean aiFillEnabled;
    private AiFillPolicy aiFillPolicy;

    /** 是否可分配 */
    private boolean enabled;
    /** 是否在大厅推荐 */
    private boolean featured;

    // 统计
    private int totalGamesPlayed;
    private long totalMatchesMade;
    private int peakConcurrentPlayers;
    private int avgGameDurationSeconds;
    private Long lastGameStartedAt;

    private long createdAt;
    private long updatedAt;

    public boolean hasSpace() {
        return currentPlayerCount < maxPlayersPerGame;
    }
}
