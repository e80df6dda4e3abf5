package com.careerhub.matchservice.games.careermatch.config;

import com.careerhub.matchservice.games.careermatch.domain.enums.AiFillPolicy;
import com.careerhub.matchservice.games.careermatch.domain.enums.Difficulty;
import com.careerhub.matchservice.games.careermatch.domain.enums.TurnTimeoutMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 职业翻牌游戏配置（前缀 career-match）。
 *
 * 支持通过 application.yml 或环境变量覆盖。
 */
@Data
@Component
@ConfigurationProperties(prefix = "career-match")
public class CareerMatchProperties {

    private Reveal reveal = new Reveal();
    private Turn turn = new Turn();
    private AiFill aiFill = new AiFill();
    private Intermission intermission = new Intermission();
    private Scoring scoring = new Scoring();
    private Lock lock = new Lock();
    private Seed seed = new Seed();

    /**
     * 第二翻后的揭示时长：所有观察者都要看到两张正面后才结算。
     */
    @Data
    public static class Reveal {
        /** 两张牌同时朝上的展示时长（毫秒） */
        private long holdMs = 1200;
        /** 未配对时在复位前额外停留的时长（毫秒） */
        private long mismatchHoldMs = 1500;
    }

    @Data
    public static class Turn {
        /** 房间上的 turnTimeLimitSeconds 如何生效 */
        private TurnTimeoutMode timeoutMode = TurnTimeoutMode.ADVISORY;
    }

    @Data
    public static class AiFill {
        /** 第一位玩家入座后，等待多久仍未满员则由 AI 补位开局 */
        private int waitSeconds = 10;
        /** 自定义 AI 人设；为空时使用内置名单 */
        private List<PersonaConfig> personas = new ArrayList<>();
    }

    @Data
    public static class PersonaConfig {
        private String id;
        private String displayName;
        private String personality = "friendly";
    }

    @Data
    public static class Intermission {
        /** 种子房间未指定时的默认局间休息（秒） */
        private int seconds = 10;
    }

    @Data
    public static class Scoring {
        private int matchXp = 100;
        private int streakBonusXp = 50;
        /** 连击数达到该值（含）时发放奖励 */
        private int streakThreshold = 3;
        /** 局内 XP : 平台 XP */
        private int conversionRatio = 10;
    }

    @Data
    public static class Lock {
        /** 对局 / 房间锁的过期时间，必须大于揭示总时长 */
        private int ttlSeconds = 30;
        /** 结算时等待房间锁的上限 */
        private long roomWaitMs = 5000;
    }

    @Data
    public static class Seed {
        private boolean enabled = true;
        private List<RoomSeed> rooms = new ArrayList<>();
    }

    @Data
    public static class RoomSeed {
        private String code;
        private String name;
        private Difficulty difficulty = Difficulty.EASY;
        private int totalPairs = 6;
        private int gridRows = 3;
        private int gridCols = 4;
        private int maxPlayers = 6;
        private int turnTimeLimitSeconds = 30;
        /** 为 0 时取 intermission.seconds */
        private int intermissionSeconds;
        private boolean aiFillEnabled = true;
        private AiFillPolicy aiFillPolicy = AiFillPolicy.MIXED;
        private boolean featured = true;
    }
}
