package com.careerhub.matchservice.games.careermatch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AI 人设（只负责身份与展示，不包含出牌策略）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AiPersona {
    private String id;
    private String displayName;
    private String personality;
}
