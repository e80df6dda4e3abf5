package com.careerhub.matchservice.games.careermatch.domain.model;

import com.careerhub.matchservice.games.careermatch.domain.enums.SessionStatus;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单局对局。
 * <p>
 * 不变量：pairsRemaining + 已配对卡牌数 / 2 == totalPairs。
 * version 用于乐观并发控制（每次成功保存 +1）。
 */
@Data
public class GameSession {
    private String id;
    private String roomId;
    private int gameNumber;
    private SessionStatus status;

    private int totalPairs;
    private int pairsRemaining;

    /** 当前回合持有者（参与者ID）；未开局时为 null */
    private String currentTurnPlayerId;
    private int currentTurnNumber;
    /** 本回合第一张翻开的位置；null 表示下一次翻牌是“第一翻” */
    private Integer firstCardFlipped;
    private Long firstCardFlippedAt;
    /** 本回合第二张翻开的位置，仅在揭示等待期间存在 */
    private Integer secondCardFlipped;

    private List<WinnerEntry> winners = new ArrayList<>();

    private int totalParticipants;
    private int humanParticipants;
    private int aiParticipants;
    private int totalTurns;

    private long createdAt;
    /** 开局时间；null 表示尚未开局 */
    private Long startedAt;
    private Long completedAt;
    private Integer durationSeconds;

    private long version;

    public boolean started() {
        return startedAt != null;
    }
}
