package com.careerhub.matchservice.games.careermatch.service;

import com.careerhub.matchservice.games.careermatch.config.CareerMatchProperties;
import com.careerhub.matchservice.games.careermatch.domain.dto.MatchAward;
import com.careerhub.matchservice.games.careermatch.domain.model.Participant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 计分：配对基础分 + 连击奖励，并按固定比例折算平台 XP（始终向下取整）。
 */
@Service
@RequiredArgsConstructor
public class ScoringService {

    private final CareerMatchProperties props;

    /**
     * 为一次配对成功计分，直接修改参与者的连击与 XP 字段（pairsMatched 由调用方维护）。
     */
    public MatchAward awardMatch(Participant participant) {
        CareerMatchProperties.Scoring s = props.getScoring();
        int streak = participant.getCurrentStreak() + 1;
        int xp = s.getMatchXp() + (streak >= s.getStreakThreshold() ? s.getStreakBonusXp() : 0);
        int platformXp = toPlatformXp(xp);

        participant.setCurrentStreak(streak);
        participant.setMaxStreak(Math.max(participant.getMaxStreak(), streak));
        participant.setArcadeXp(participant.getArcadeXp() + xp);
        participant.setTotalXp(participant.getTotalXp() + platformXp);
        return new MatchAward(xp, platformXp, streak);
    }

    /**
     * 连击中断（未配对或超时）
     */
    public void breakStreak(Participant participant) {
        participant.setCurrentStreak(0);
    }

    /**
     * 局内 XP 折算平台 XP：floor(arcadeXp / ratio)。
     */
    public int toPlatformXp(int arcadeXp) {
        if (arcadeXp < 0) {
            throw new IllegalArgumentException("arcadeXp must be >= 0: " + arcadeXp);
        }
        return Math.floorDiv(arcadeXp, props.getScoring().getConversionRatio());
    }
}
