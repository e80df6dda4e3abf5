package com.careerhub.matchservice.games.careermatch.domain.port;

import com.careerhub.matchservice.games.careermatch.domain.dto.CareerMatchResult;

/**
 * 平台 XP / 排行榜账本（外部协作方）。失败不影响对局结算。
 */
public interface XpLedger {

    void postResults(CareerMatchResult result);
}
