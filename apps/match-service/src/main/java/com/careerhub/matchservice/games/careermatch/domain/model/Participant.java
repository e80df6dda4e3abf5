package com.careerhub.matchservice.games.careermatch.domain.model;

import com.careerhub.matchservice.games.careermatch.domain.enums.ConnectionStatus;
import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.enums.ParticipantType;
import lombok.Data;

/**
 * 对局参与者（真人或 AI）。
 * 同一局内任意时刻至多一人 activeTurn = true。
 */
@Data
public class Participant {
    private String id;
    private String sessionId;
    private ParticipantType participantType;

    /** 真人用户ID；AI 为 null */
    private String userId;
    /** AI 人设ID；真人为 null */
    private String aiPersonaId;
    private String displayName;
    private Difficulty aiDifficulty;
    private String aiPersonality;

    // 单局得分
    private int pairsMatched;
    private int arcadeXp;
    private int totalXp;
    private int currentStreak;
    private int maxStreak;
    private int turnsTaken;

    private boolean activeTurn;
    private Long turnStartedAt;

    private long joinedAt;
    /** 入座顺序（从 1 开始），轮转顺序按它排列 */
    private int joinSequence;
    private ConnectionStatus connectionStatus;
    private boolean active;

    /**
     * 请求方身份是否就是本参与者（参与者ID 或真人 userId 均可）。
     */
    public boolean identifiedBy(String actorId) {
        if (actorId == null) {
            return false;
        }
        return actorId.equals(id) || (userId != null && actorId.equals(userId));
    }
}
