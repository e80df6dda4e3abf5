package com.careerhub.matchservice.games.careermatch.domain.port;

import com.careerhub.matchservice.games.careermatch.domain.model.AiPersona;

import java.util.List;
import java.util.Set;

/**
 * AI 人设池（外部协作方）。
 */
public interface AiPersonaPool {

    /**
     * 随机抽取不重复的人设。
     * @param count       需要的数量
     * @param excludedIds 已在该房间入座的人设，不能再抽
     * @return 至多 count 个人设；池子不够时返回更少
     */
    List<AiPersona> draw(int count, Set<String> excludedIds);
}
